package com.synthetic.cycleengine.domain.model;

import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;

@Getter
@Builder
public class CycleStatus {

    private String symbol;
    private long cycle;
    private CycleState state;
    private Instant cycleStartTime;
    private Instant offchainStartTime;
    private Instant onchainStartTime;
    private BigDecimal settlementPrice;
    private BigDecimal lastSettlementPrice;
    private BigDecimal interestIndex;
    private BigDecimal pendingDeposits;
    private BigDecimal pendingRedemptions;
    private BigDecimal totalCommitted;
    private BigDecimal splitMultiplier;
    private int activeLiquidityProviders;
    private int settledLiquidityProviders;
}
