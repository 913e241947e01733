package com.amot.backend.services.ledger;

import java.time.LocalDateTime;

import com.amot.backend.enums.PaymentStatus;

/**
 * Settlement fields of one edge as read from (or written back to) its share.
 */
public record SettlementSnapshot(PaymentStatus status, LocalDateTime markedPaidAt, LocalDateTime confirmedAt) {

    public SettlementSnapshot {
        if (status == null) {
            status = PaymentStatus.UNPAID;
        }
    }

    public static SettlementSnapshot unpaid() {
        return new SettlementSnapshot(PaymentStatus.UNPAID, null, null);
    }
}
