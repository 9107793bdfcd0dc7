package com.synthetic.cycleengine.infra.token;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * How a synthetic token stores balances relative to the amounts it reports.
 * <ul>
 *   <li>{@link ScaledBalance}: stores pre-split units; a split only moves the multiplier.</li>
 *   <li>{@link ReservePegged}: stores reported units; a split rewrites every balance.</li>
 *   <li>{@link PriceScaled}: stores value at a fixed reference price.</li>
 * </ul>
 */
public sealed interface TokenAccounting {

    int SCALE = 18;

    BigDecimal toStored(BigDecimal amount, BigDecimal multiplier, RoundingMode mode);

    BigDecimal toReported(BigDecimal stored, BigDecimal multiplier);

    /** True when {@code applySplit} has to rescale stored balances. */
    boolean rebasesOnSplit();

    enum Scheme {
        SCALED_BALANCE,
        RESERVE_PEGGED,
        PRICE_SCALED
    }

    static TokenAccounting of(Scheme scheme, BigDecimal referencePrice) {
        return switch (scheme) {
            case SCALED_BALANCE -> new ScaledBalance();
            case RESERVE_PEGGED -> new ReservePegged();
            case PRICE_SCALED -> new PriceScaled(referencePrice);
        };
    }

    record ScaledBalance() implements TokenAccounting {

        @Override
        public BigDecimal toStored(BigDecimal amount, BigDecimal multiplier, RoundingMode mode) {
            return amount.divide(multiplier, SCALE, mode);
        }

        @Override
        public BigDecimal toReported(BigDecimal stored, BigDecimal multiplier) {
            return stored.multiply(multiplier).setScale(SCALE, RoundingMode.DOWN);
        }

        @Override
        public boolean rebasesOnSplit() {
            return false;
        }
    }

    record ReservePegged() implements TokenAccounting {

        @Override
        public BigDecimal toStored(BigDecimal amount, BigDecimal multiplier, RoundingMode mode) {
            return amount.setScale(SCALE, mode);
        }

        @Override
        public BigDecimal toReported(BigDecimal stored, BigDecimal multiplier) {
            return stored;
        }

        @Override
        public boolean rebasesOnSplit() {
            return true;
        }
    }

    record PriceScaled(BigDecimal referencePrice) implements TokenAccounting {

        public PriceScaled {
            if (referencePrice == null || referencePrice.signum() <= 0) {
                throw new IllegalArgumentException("referencePrice must be positive");
            }
        }

        @Override
        public BigDecimal toStored(BigDecimal amount, BigDecimal multiplier, RoundingMode mode) {
            return amount.multiply(referencePrice).divide(multiplier, SCALE, mode);
        }

        @Override
        public BigDecimal toReported(BigDecimal stored, BigDecimal multiplier) {
            return stored.multiply(multiplier).divide(referencePrice, SCALE, RoundingMode.DOWN);
        }

        @Override
        public boolean rebasesOnSplit() {
            return false;
        }
    }
}
