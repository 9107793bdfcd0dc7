package com.synthetic.cycleengine.api.dto;

import java.math.BigDecimal;

public record LiquidationRequest(String liquidator, String target, BigDecimal amount) {
}
