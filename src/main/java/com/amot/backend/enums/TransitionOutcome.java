package com.amot.backend.enums;

public enum TransitionOutcome {
    APPLIED,
    NO_OP,
    UNAUTHORIZED,
    ILLEGAL_TRANSITION
}
