package com.amot.backend.services.ledger;

import java.util.List;

/**
 * Shares computed for a bill and whether they may be persisted as they are.
 */
public record SplitOutcome(List<Share> shares, ValidationResult validation) {

    public SplitOutcome {
        shares = shares == null ? List.of() : List.copyOf(shares);
    }

    public boolean isValid() {
        return validation.valid();
    }

    public static SplitOutcome rejected(String error) {
        return new SplitOutcome(List.of(), ValidationResult.invalid(error, null));
    }
}
