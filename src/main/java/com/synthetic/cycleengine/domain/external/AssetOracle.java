package com.synthetic.cycleengine.domain.external;

import com.synthetic.cycleengine.domain.model.OracleQuote;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Price source for one asset. How the data is fetched is not the engine's concern.
 */
public interface AssetOracle {

    String symbol();

    /** Latest close; throws a staleness error if no quote was ever received. */
    BigDecimal currentPrice();

    OracleQuote latestQuote();

    boolean isMarketOpen();

    /** {@link Instant#EPOCH} until the first update. */
    Instant lastUpdateTimestamp();

    boolean splitDetected();

    BigDecimal preSplitPrice();

    /**
     * @return true when a split was detected and its ratio equals {@code ratioNum:ratioDen}
     */
    boolean verifySplit(long ratioNum, long ratioDen);
}
