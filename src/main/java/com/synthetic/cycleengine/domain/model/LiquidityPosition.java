package com.synthetic.cycleengine.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LiquidityPosition {

    private BigDecimal liquidityCommitment;
    private BigDecimal collateralAmount;
    private BigDecimal interestAccrued;
    private long lastRebalanceCycle;
}
