package com.amot.backend.services.ledger;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Two-decimal money arithmetic shared by the ledger calculators.
 */
public final class MoneyUtils {

    public static final int SCALE = 2;
    public static final BigDecimal TOLERANCE = new BigDecimal("0.01");
    public static final BigDecimal ONE_HUNDRED = new BigDecimal("100");

    private MoneyUtils() {
    }

    public static BigDecimal round(BigDecimal value) {
        return orZero(value).setScale(SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }

    public static boolean withinTolerance(BigDecimal actual, BigDecimal expected) {
        return orZero(actual).subtract(orZero(expected)).abs().compareTo(TOLERANCE) <= 0;
    }

    // 10.50 and 10.500 fit, 10.505 does not
    public static boolean fitsScale(BigDecimal value) {
        return value == null || value.stripTrailingZeros().scale() <= SCALE;
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    // 90.00 -> "90", 33.30 -> "33.3"
    public static String format(BigDecimal value) {
        return round(value).stripTrailingZeros().toPlainString();
    }
}
