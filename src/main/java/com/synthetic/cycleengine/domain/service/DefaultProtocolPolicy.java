package com.synthetic.cycleengine.domain.service;

import com.synthetic.cycleengine.domain.model.HealthStatus;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;

@Slf4j
public class DefaultProtocolPolicy implements ProtocolPolicy {

    private static final BigDecimal LONG_MAX = BigDecimal.valueOf(Long.MAX_VALUE);

    private final PolicyParameters params;

    public DefaultProtocolPolicy(PolicyParameters params) {
        this.params = params;
        log.info("[Policy] base={} rate1={} max={} tiers=[{}, {}] user={}/{} lp={}/{} fee={}",
                params.baseRate(), params.rate1(), params.maxRate(),
                params.tier1(), params.tier2(),
                params.userHealthyRatio(), params.userLiquidationThreshold(),
                params.lpHealthyRatio(), params.lpLiquidationThreshold(),
                params.protocolFee());
    }

    @Override
    public PolicyParameters parameters() {
        return params;
    }

    @Override
    public long interestRate(long utilizationBps) {
        long u = Math.max(0L, utilizationBps);
        if (u <= params.tier1()) {
            return params.baseRate();
        }
        if (u <= params.tier2()) {
            return interpolate(u, params.tier1(), params.tier2(), params.baseRate(), params.rate1());
        }
        if (u <= Decimals.BPS) {
            return interpolate(u, params.tier2(), Decimals.BPS, params.rate1(), params.maxRate());
        }
        return params.maxRate();
    }

    @Override
    public BigDecimal requiredCollateral(BigDecimal exposureValue, long ratioBps) {
        return Decimals.applyBps(exposureValue, ratioBps);
    }

    @Override
    public HealthStatus health(long currentRatioBps, long healthyRatioBps, long liquidationRatioBps) {
        if (currentRatioBps < liquidationRatioBps) {
            return HealthStatus.LIQUIDATABLE;
        }
        if (currentRatioBps < healthyRatioBps) {
            return HealthStatus.WARNING;
        }
        return HealthStatus.HEALTHY;
    }

    @Override
    public long collateralRatio(BigDecimal collateral, BigDecimal exposureValue) {
        if (exposureValue.signum() <= 0) {
            return Long.MAX_VALUE;
        }
        return toBps(collateral, exposureValue);
    }

    @Override
    public BigDecimal availableLiquidity(BigDecimal totalCommitted, BigDecimal pendingAdditions,
                                         BigDecimal pendingReductions, BigDecimal utilized) {
        BigDecimal available = totalCommitted.add(pendingAdditions)
                .subtract(pendingReductions)
                .subtract(utilized);
        return Decimals.nonNegative(Decimals.down(available));
    }

    @Override
    public long utilization(BigDecimal notional, BigDecimal totalCommitted) {
        if (totalCommitted.signum() <= 0) {
            return 0L;
        }
        return toBps(notional, totalCommitted);
    }

    private static long toBps(BigDecimal numerator, BigDecimal denominator) {
        BigDecimal ratio = numerator.multiply(Decimals.BPS_DECIMAL)
                .divide(denominator, 0, RoundingMode.DOWN);
        return ratio.compareTo(LONG_MAX) >= 0 ? Long.MAX_VALUE : ratio.longValue();
    }

    private static long interpolate(long u, long fromU, long toU, long fromRate, long toRate) {
        return fromRate + (toRate - fromRate) * (u - fromU) / (toU - fromU);
    }
}
