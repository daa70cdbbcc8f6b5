package com.tradeadvisor.backend.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class MoneyUtils {

    public static final int SCALE = 4;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE, RoundingMode.HALF_UP);
    public static final BigDecimal ONE = BigDecimal.ONE.setScale(SCALE, RoundingMode.HALF_UP);
    public static final BigDecimal HUNDRED = new BigDecimal("100");
    public static final BigDecimal BASIS_POINTS = new BigDecimal("10000");

    private MoneyUtils() {
    }

    public static BigDecimal bd(String value) {
        if (value == null || value.isBlank()) {
            return ZERO;
        }
        return scale(new BigDecimal(value));
    }

    public static BigDecimal bd(double value) {
        return scale(BigDecimal.valueOf(value));
    }

    public static BigDecimal scale(BigDecimal value) {
        if (value == null) {
            return ZERO;
        }
        return value.setScale(SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal add(BigDecimal left, BigDecimal right) {
        return scale(scale(left).add(scale(right)));
    }

    public static BigDecimal subtract(BigDecimal left, BigDecimal right) {
        return scale(scale(left).subtract(scale(right)));
    }

    public static BigDecimal multiply(BigDecimal left, BigDecimal right) {
        return scale(scale(left).multiply(scale(right)));
    }

    public static BigDecimal multiply(BigDecimal left, int right) {
        return scale(scale(left).multiply(BigDecimal.valueOf(right)));
    }

    /**
     * {@code amount * rate} with only the product rounded, so fractional rates such as
     * commissions keep their full precision.
     */
    public static BigDecimal applyRate(BigDecimal amount, BigDecimal rate) {
        if (amount == null || rate == null) {
            return ZERO;
        }
        return scale(amount.multiply(rate));
    }

    /**
     * Division at money scale; a zero divisor yields zero.
     */
    public static BigDecimal divide(BigDecimal dividend, BigDecimal divisor) {
        if (divisor == null || divisor.signum() == 0) {
            return ZERO;
        }
        return scale(dividend).divide(divisor, SCALE, RoundingMode.HALF_UP);
    }

    /**
     * {@code part / whole * 100}, or zero when {@code whole} is zero.
     */
    public static BigDecimal percent(BigDecimal part, BigDecimal whole) {
        if (whole == null || whole.signum() == 0) {
            return ZERO;
        }
        return scale(scale(part).multiply(HUNDRED).divide(whole, SCALE, RoundingMode.HALF_UP));
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }
}
