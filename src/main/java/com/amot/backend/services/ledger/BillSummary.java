package com.amot.backend.services.ledger;

import java.math.BigDecimal;

public record BillSummary(
        BigDecimal totalOwed,
        BigDecimal totalOwing,
        BigDecimal totalSettled,
        BigDecimal balance,
        int billCount
) {
}
