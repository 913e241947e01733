package com.amot.backend.services.ledger;

import static com.amot.backend.services.ledger.MoneyUtils.ONE_HUNDRED;
import static com.amot.backend.services.ledger.MoneyUtils.format;
import static com.amot.backend.services.ledger.MoneyUtils.orZero;
import static com.amot.backend.services.ledger.MoneyUtils.round;
import static com.amot.backend.services.ledger.MoneyUtils.withinTolerance;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

/**
 * Turns a bill total and a split strategy into per-participant shares.
 *
 * <p>Stateless: every method depends only on its arguments, so a single instance is shared
 * across requests.
 */
@Component
public class SplitCalculator {

    private static final int DIVISION_SCALE = 10;

    /**
     * Divides {@code total} evenly. Each share is rounded to cents and the rounding residual is
     * added to the last participant, so the shares always add up to {@code total}.
     */
    public List<Share> equalSplit(BigDecimal total, List<String> participantIds) {
        if (participantIds == null || participantIds.isEmpty()) {
            return List.of();
        }

        BigDecimal amountPerPerson = orZero(total)
                .divide(BigDecimal.valueOf(participantIds.size()), MoneyUtils.SCALE, RoundingMode.HALF_UP);

        List<Share> shares = new ArrayList<>(participantIds.size());
        for (String id : participantIds) {
            shares.add(Share.of(id, amountPerPerson));
        }

        BigDecimal currentTotal = sumAmounts(shares);
        BigDecimal difference = round(orZero(total).subtract(currentTotal));

        if (difference.signum() != 0) {
            int last = shares.size() - 1;
            Share lastShare = shares.get(last);
            shares.set(last, lastShare.withAmount(round(lastShare.amount().add(difference))));
        }

        return shares;
    }

    public ValidationResult validateCustomSplit(List<Share> shares, BigDecimal total) {
        BigDecimal actual = round(sumAmounts(shares));
        BigDecimal expected = round(total);

        if (!withinTolerance(actual, expected)) {
            return ValidationResult.invalid(
                    "Total must equal " + format(expected) + ". Current total: " + format(actual),
                    actual
            );
        }
        return ValidationResult.ok(actual);
    }

    public ValidationResult validatePercentageSplit(List<Share> shares) {
        BigDecimal total = BigDecimal.ZERO;
        if (shares != null) {
            for (Share share : shares) {
                if (share != null) {
                    total = total.add(orZero(share.percentage()));
                }
            }
        }
        BigDecimal rounded = round(total);

        if (!withinTolerance(rounded, ONE_HUNDRED)) {
            return ValidationResult.invalid(
                    "Percentages must total 100%. Current total: " + format(rounded) + "%",
                    rounded
            );
        }
        return ValidationResult.ok(rounded);
    }

    /**
     * Amount of each share is {@code total * percentage / 100}, rounded to cents.
     * No residual correction: the result may differ from {@code total} by a cent.
     */
    public List<Share> percentageSplit(BigDecimal total, List<Share> shares) {
        if (shares == null || shares.isEmpty()) {
            return List.of();
        }
        BigDecimal base = orZero(total);
        return shares.stream()
                .map(share -> share.withAmount(round(
                        base.multiply(orZero(share.percentage()))
                                .divide(ONE_HUNDRED, DIVISION_SCALE, RoundingMode.HALF_UP))))
                .toList();
    }

    /**
     * Each item's price is divided among its assignees; participants with no items owe zero.
     * Assignees outside {@code participantIds} are ignored. No residual correction.
     */
    public List<Share> itemBasedSplit(List<BillItem> items, List<String> participantIds) {
        Map<String, BigDecimal> accumulated = new LinkedHashMap<>();
        if (participantIds != null) {
            for (String id : participantIds) {
                accumulated.put(id, BigDecimal.ZERO);
            }
        }

        if (items != null) {
            for (BillItem item : items) {
                if (item == null || item.assignedTo().isEmpty()) continue;

                BigDecimal pricePerPerson = orZero(item.price())
                        .divide(BigDecimal.valueOf(item.assignedTo().size()), DIVISION_SCALE, RoundingMode.HALF_UP);

                for (String userId : item.assignedTo()) {
                    accumulated.computeIfPresent(userId, (k, v) -> v.add(pricePerPerson));
                }
            }
        }

        return accumulated.entrySet().stream()
                .map(e -> Share.of(e.getKey(), round(e.getValue())))
                .toList();
    }

    public BigDecimal sumAmounts(List<Share> shares) {
        BigDecimal sum = BigDecimal.ZERO;
        if (shares == null) {
            return sum;
        }
        for (Share share : shares) {
            if (share != null) {
                sum = sum.add(orZero(share.amount()));
            }
        }
        return sum;
    }
}
