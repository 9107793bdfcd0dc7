package com.synthetic.cycleengine.domain.service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-point helpers. Amounts, prices and indexes carry 18 decimals; ratios and
 * rates are basis points. Payouts round down, charges round up.
 */
public final class Decimals {

    public static final int SCALE = 18;
    public static final long BPS = 10_000L;
    public static final BigDecimal BPS_DECIMAL = BigDecimal.valueOf(BPS);
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);
    public static final BigDecimal ONE = BigDecimal.ONE.setScale(SCALE);

    private Decimals() {
    }

    public static BigDecimal down(BigDecimal value) {
        return value.setScale(SCALE, RoundingMode.DOWN);
    }

    public static BigDecimal up(BigDecimal value) {
        return value.setScale(SCALE, RoundingMode.UP);
    }

    public static BigDecimal mulDown(BigDecimal a, BigDecimal b) {
        return down(a.multiply(b));
    }

    public static BigDecimal divDown(BigDecimal a, BigDecimal b) {
        return a.divide(b, SCALE, RoundingMode.DOWN);
    }

    /** {@code value * numerator / denominator}, multiplied before dividing. */
    public static BigDecimal mulDivDown(BigDecimal value, BigDecimal numerator, BigDecimal denominator) {
        return value.multiply(numerator).divide(denominator, SCALE, RoundingMode.DOWN);
    }

    public static BigDecimal applyBps(BigDecimal value, long bps) {
        return mulDivDown(value, BigDecimal.valueOf(bps), BPS_DECIMAL);
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    public static BigDecimal nonNegative(BigDecimal value) {
        return value.signum() < 0 ? ZERO : value;
    }
}
