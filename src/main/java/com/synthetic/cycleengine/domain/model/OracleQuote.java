package com.synthetic.cycleengine.domain.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Daily bar pushed by the price feeder. The close is the tradable price.
 */
public record OracleQuote(
        BigDecimal open,
        BigDecimal high,
        BigDecimal low,
        BigDecimal close,
        Instant timestamp
) {
}
