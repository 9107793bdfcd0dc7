package com.synthetic.cycleengine.domain.service;

import com.synthetic.cycleengine.domain.external.AssetOracle;
import com.synthetic.cycleengine.domain.external.SyntheticToken;

import java.math.BigDecimal;

/**
 * Converts between pre-split shares, reported asset amounts and reserve value.
 */
final class PoolValuation {

    private final CycleBook book;
    private final SyntheticToken token;
    private final AssetOracle oracle;

    PoolValuation(CycleBook book, SyntheticToken token, AssetOracle oracle) {
        this.book = book;
        this.token = token;
        this.oracle = oracle;
    }

    BigDecimal toAsset(BigDecimal shares) {
        return Decimals.mulDown(shares, token.splitMultiplier());
    }

    BigDecimal toShares(BigDecimal assetAmount) {
        return Decimals.divDown(assetAmount, token.splitMultiplier());
    }

    BigDecimal price() {
        return oracle.currentPrice();
    }

    /** Reserve value of {@code shares} at the oracle price. */
    BigDecimal value(BigDecimal shares) {
        if (shares.signum() == 0) {
            return Decimals.ZERO;
        }
        return Decimals.down(shares.multiply(token.splitMultiplier()).multiply(price()));
    }

    /** Synthetic notional outstanding. */
    BigDecimal notional() {
        return value(book.getTotalAssetShares());
    }

    /** Notional plus deposits still waiting for settlement. */
    BigDecimal utilized() {
        return notional().add(book.getPendingDeposits());
    }
}
