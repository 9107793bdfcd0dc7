package com.synthetic.cycleengine.domain.model;

public enum UserRequestType {
    NONE,
    DEPOSIT,
    REDEEM,
    LIQUIDATE
}
