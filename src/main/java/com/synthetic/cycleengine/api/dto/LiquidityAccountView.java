package com.synthetic.cycleengine.api.dto;

import com.synthetic.cycleengine.domain.model.HealthStatus;
import com.synthetic.cycleengine.domain.model.LiquidityPosition;
import com.synthetic.cycleengine.domain.model.LiquidityRequest;

import java.math.BigDecimal;

public record LiquidityAccountView(
        String account,
        LiquidityPosition position,
        LiquidityRequest request,
        HealthStatus health,
        BigDecimal exposure,
        BigDecimal reserveBalance
) {
}
