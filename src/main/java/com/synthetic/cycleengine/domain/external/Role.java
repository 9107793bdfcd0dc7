package com.synthetic.cycleengine.domain.external;

public enum Role {
    ADMIN,
    LIQUIDITY_PROVIDER
}
