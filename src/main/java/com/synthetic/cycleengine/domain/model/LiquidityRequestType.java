package com.synthetic.cycleengine.domain.model;

public enum LiquidityRequestType {
    NONE,
    ADD_LIQUIDITY,
    REDUCE_LIQUIDITY,
    LIQUIDATE
}
