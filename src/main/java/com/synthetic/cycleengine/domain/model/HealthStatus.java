package com.synthetic.cycleengine.domain.model;

public enum HealthStatus {
    LIQUIDATABLE(1),
    WARNING(2),
    HEALTHY(3);

    private final int code;

    HealthStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
