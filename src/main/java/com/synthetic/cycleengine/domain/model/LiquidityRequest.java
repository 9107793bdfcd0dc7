package com.synthetic.cycleengine.domain.model;

import java.math.BigDecimal;

/**
 * An LP's pending commitment change; amounts are in reserve units.
 */
public record LiquidityRequest(
        LiquidityRequestType type,
        BigDecimal amount,
        String target,
        long cycle
) {

    public static final LiquidityRequest NONE =
            new LiquidityRequest(LiquidityRequestType.NONE, BigDecimal.ZERO, null, 0L);

    public boolean isNone() {
        return type == LiquidityRequestType.NONE;
    }
}
