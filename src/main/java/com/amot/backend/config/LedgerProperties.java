package com.amot.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.amot.backend.enums.BillCategory;

@ConfigurationProperties(prefix = "amot.ledger")
public record LedgerProperties(
        String currency,
        BillCategory defaultCategory,
        String defaultPaymentMethod
) {
    public LedgerProperties {
        if (currency == null || currency.isBlank()) {
            currency = "PHP";
        }
        if (defaultCategory == null) {
            defaultCategory = BillCategory.OTHER;
        }
        if (defaultPaymentMethod == null || defaultPaymentMethod.isBlank()) {
            defaultPaymentMethod = "manual";
        }
    }
}
