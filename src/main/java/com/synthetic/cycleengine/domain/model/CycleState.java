package com.synthetic.cycleengine.domain.model;

public enum CycleState {
    ACTIVE,
    REBALANCING_OFFCHAIN,
    REBALANCING_ONCHAIN,
    HALTED
}
