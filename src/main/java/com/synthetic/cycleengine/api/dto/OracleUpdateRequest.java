package com.synthetic.cycleengine.api.dto;

import java.math.BigDecimal;

/**
 * Daily candle pushed by the price feeder.
 *
 * @param timestamp candle time in epoch seconds
 */
public record OracleUpdateRequest(BigDecimal open, BigDecimal high, BigDecimal low, BigDecimal close,
                                  long timestamp, boolean marketOpen) {
}
