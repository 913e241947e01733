package com.amot.backend.services.ledger;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Read-only view of a bill as consumed by the ledger aggregations.
 */
public record LedgerBill(String billId, String paidBy, List<Share> shares, LocalDateTime updatedAt) {

    public LedgerBill {
        shares = shares == null ? List.of() : List.copyOf(shares);
    }

    public boolean involves(String userId) {
        if (userId == null) {
            return false;
        }
        if (userId.equals(paidBy)) {
            return true;
        }
        return shares.stream().anyMatch(s -> userId.equals(s.userId()));
    }
}
