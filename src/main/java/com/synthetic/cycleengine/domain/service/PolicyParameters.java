package com.synthetic.cycleengine.domain.service;

/**
 * Interest curve and collateral ratios, all in basis points.
 *
 * @param baseRate                  rate below {@code tier1}
 * @param rate1                     rate at {@code tier2}
 * @param maxRate                   rate at and above 100% utilization
 * @param tier1                     first utilization breakpoint
 * @param tier2                     second utilization breakpoint
 * @param userHealthyRatio          minimum user collateral to exposure; also the deposit requirement
 * @param userLiquidationThreshold  user ratio below which a position is liquidatable
 * @param lpHealthyRatio            minimum LP collateral to commitment
 * @param lpLiquidationThreshold    LP ratio below which an LP is liquidatable
 * @param lpLiquidationReward       share of the seized LP collateral paid to the liquidator
 * @param maxLiquidationShare       largest share of a position one liquidation may take
 * @param protocolFee               share of collected interest kept by the protocol
 */
public record PolicyParameters(
        long baseRate,
        long rate1,
        long maxRate,
        long tier1,
        long tier2,
        long userHealthyRatio,
        long userLiquidationThreshold,
        long lpHealthyRatio,
        long lpLiquidationThreshold,
        long lpLiquidationReward,
        long maxLiquidationShare,
        long protocolFee
) {

    public PolicyParameters {
        require(tier1 > 0 && tier1 < tier2, "tier1 must be positive and below tier2");
        require(tier2 < Decimals.BPS, "tier2 must be below 100%");
        require(baseRate >= 0 && baseRate <= rate1 && rate1 <= maxRate, "rates must be non-decreasing");
        require(userLiquidationThreshold > 0 && userLiquidationThreshold < userHealthyRatio,
                "user liquidation threshold must be below the healthy ratio");
        require(lpLiquidationThreshold > 0 && lpLiquidationThreshold < lpHealthyRatio,
                "LP liquidation threshold must be below the healthy ratio");
        require(lpLiquidationReward >= 0 && lpLiquidationReward <= Decimals.BPS, "LP reward out of range");
        require(maxLiquidationShare > 0 && maxLiquidationShare <= Decimals.BPS, "liquidation share out of range");
        require(protocolFee >= 0 && protocolFee <= Decimals.BPS, "protocol fee out of range");
    }

    public static PolicyParameters defaults() {
        return new PolicyParameters(
                600, 1_200, 3_000,
                6_500, 8_500,
                2_000, 1_250,
                5_000, 3_000,
                5_000,
                3_000,
                1_000);
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }
}
