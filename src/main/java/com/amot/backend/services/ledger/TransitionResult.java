package com.amot.backend.services.ledger;

import com.amot.backend.enums.TransitionOutcome;

public record TransitionResult(TransitionOutcome outcome, SettlementSnapshot snapshot, String message) {
}
