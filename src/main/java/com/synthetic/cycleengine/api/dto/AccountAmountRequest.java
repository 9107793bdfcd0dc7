package com.synthetic.cycleengine.api.dto;

import java.math.BigDecimal;

public record AccountAmountRequest(String account, BigDecimal amount) {
}
