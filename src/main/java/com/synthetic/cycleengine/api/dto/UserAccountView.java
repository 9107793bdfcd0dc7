package com.synthetic.cycleengine.api.dto;

import com.synthetic.cycleengine.domain.model.HealthStatus;
import com.synthetic.cycleengine.domain.model.UserPosition;
import com.synthetic.cycleengine.domain.model.UserRequest;

import java.math.BigDecimal;

public record UserAccountView(
        String account,
        BigDecimal assetAmount,
        UserPosition position,
        UserRequest request,
        HealthStatus health,
        BigDecimal interestDebt,
        BigDecimal tokenBalance,
        BigDecimal reserveBalance
) {
}
