package com.amot.backend.services.ledger;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import com.amot.backend.enums.PaymentStatus;

/**
 * Directed obligation: {@code fromUserId} owes {@code toUserId} (the bill's payer) {@code amount}.
 * Derived from a share on demand, never stored on its own.
 */
public record PaymentEdge(
        String fromUserId,
        String toUserId,
        BigDecimal amount,
        PaymentStatus status,
        LocalDateTime markedPaidAt,
        LocalDateTime confirmedAt
) {
    public boolean isSettled() {
        return status.isSettled();
    }

    public LocalDateTime settledAt() {
        return isSettled() ? confirmedAt : null;
    }
}
