package com.synthetic.cycleengine.api.dto;

import java.math.BigDecimal;

public record DepositRequest(String account, BigDecimal amount, BigDecimal collateral) {
}
