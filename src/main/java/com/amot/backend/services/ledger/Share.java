package com.amot.backend.services.ledger;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import com.amot.backend.enums.PaymentStatus;

/**
 * One participant's portion of a bill, with the settlement state persisted alongside it.
 */
public record Share(
        String userId,
        BigDecimal amount,
        BigDecimal percentage,
        PaymentStatus paymentStatus,
        LocalDateTime markedPaidAt,
        LocalDateTime confirmedAt
) {
    public Share {
        if (paymentStatus == null) {
            paymentStatus = PaymentStatus.UNPAID;
        }
    }

    public static Share of(String userId, BigDecimal amount) {
        return new Share(userId, amount, null, PaymentStatus.UNPAID, null, null);
    }

    public Share withAmount(BigDecimal newAmount) {
        return new Share(userId, newAmount, percentage, paymentStatus, markedPaidAt, confirmedAt);
    }

    public boolean isSettled() {
        return paymentStatus.isSettled();
    }
}
