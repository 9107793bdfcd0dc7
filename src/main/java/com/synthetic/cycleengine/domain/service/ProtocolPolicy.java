package com.synthetic.cycleengine.domain.service;

import com.synthetic.cycleengine.domain.model.HealthStatus;

import java.math.BigDecimal;

/**
 * Pure calculator consulted by the ledgers and the orchestrator.
 */
public interface ProtocolPolicy {

    PolicyParameters parameters();

    /** Annual rate in basis points for the given utilization. */
    long interestRate(long utilizationBps);

    BigDecimal requiredCollateral(BigDecimal exposureValue, long ratioBps);

    HealthStatus health(long currentRatioBps, long healthyRatioBps, long liquidationRatioBps);

    /** Ratio in basis points, {@link Long#MAX_VALUE} for zero exposure. */
    long collateralRatio(BigDecimal collateral, BigDecimal exposureValue);

    BigDecimal availableLiquidity(BigDecimal totalCommitted, BigDecimal pendingAdditions,
                                  BigDecimal pendingReductions, BigDecimal utilized);

    long utilization(BigDecimal notional, BigDecimal totalCommitted);

    default HealthStatus health(BigDecimal collateral, BigDecimal exposureValue,
                                long healthyRatioBps, long liquidationRatioBps) {
        if (exposureValue.signum() <= 0) {
            return HealthStatus.HEALTHY;
        }
        return health(collateralRatio(collateral, exposureValue), healthyRatioBps, liquidationRatioBps);
    }
}
