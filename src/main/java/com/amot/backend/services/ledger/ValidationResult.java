package com.amot.backend.services.ledger;

import java.math.BigDecimal;

public record ValidationResult(boolean valid, String error, BigDecimal total) {

    public static ValidationResult ok(BigDecimal total) {
        return new ValidationResult(true, null, total);
    }

    public static ValidationResult invalid(String error, BigDecimal total) {
        return new ValidationResult(false, error, total);
    }
}
