package com.amot.backend.enums;

/**
 * Settlement state of a single debtor → payer edge.
 * unpaid → pending confirmation → confirmed.
 */
public enum PaymentStatus {
    UNPAID,
    PENDING_CONFIRMATION,
    CONFIRMED;

    public boolean isSettled() {
        return this == CONFIRMED;
    }
}
