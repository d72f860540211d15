package com.retail.billkeeper.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Decimal helpers for monetary values. Amounts are kept at two decimal places,
 * rounded half-up; intermediate results are never rounded.
 */
public final class Money {

    public static final int SCALE = 2;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private Money() {
    }

    public static BigDecimal round(BigDecimal value) {
        return orZero(value).setScale(SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }

    /**
     * {@code value * percent / 100}, unrounded.
     */
    public static BigDecimal percentOf(BigDecimal value, BigDecimal percent) {
        return orZero(value).multiply(orZero(percent)).divide(HUNDRED);
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }
}
