package com.amot.backend.enums;

/**
 * Role of the acting user relative to one payment edge.
 */
public enum ParticipantRole {
    DEBTOR,
    CREDITOR,
    NONE
}
