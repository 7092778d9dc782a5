package com.tradepilot.backend.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class MoneyUtils {

    public static final int SCALE = 4;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE, RoundingMode.HALF_UP);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private MoneyUtils() {
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

    public static BigDecimal subtract(BigDecimal left, BigDecimal right) {
        return scale(scale(left).subtract(scale(right)));
    }

    public static BigDecimal add(BigDecimal left, BigDecimal right) {
        return scale(scale(left).add(scale(right)));
    }

    public static BigDecimal min(BigDecimal left, BigDecimal right) {
        return scale(left).compareTo(scale(right)) <= 0 ? scale(left) : scale(right);
    }

    /**
     * {@code pct} percent of {@code base}, e.g. {@code percentOf(1000, 60) = 600}.
     */
    public static BigDecimal percentOf(BigDecimal base, double pct) {
        return scale(scale(base).multiply(BigDecimal.valueOf(pct)).divide(HUNDRED, SCALE, RoundingMode.HALF_UP));
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    public static boolean isBelow(BigDecimal value, BigDecimal floor) {
        return scale(value).compareTo(scale(floor)) < 0;
    }
}
