package com.synthetic.cycleengine.domain.service;

import java.time.Duration;

/**
 * Phase lengths and price tolerances of one pool.
 *
 * @param haltThreshold              how long LPs may stay unsettled in the onchain phase before an admin may force them
 * @param priceDeviationToleranceBps move from the previous settlement price accepted without admin resolution
 * @param rebalancePriceToleranceBps band around the settlement price an LP may quote when settling
 */
public record CycleTimings(
        Duration cycleLength,
        Duration rebalanceLength,
        Duration haltThreshold,
        long priceDeviationToleranceBps,
        long rebalancePriceToleranceBps
) {

    public CycleTimings {
        if (cycleLength == null || cycleLength.isNegative()) {
            throw new IllegalArgumentException("cycleLength must be non-negative");
        }
        if (rebalanceLength == null || rebalanceLength.isNegative()) {
            throw new IllegalArgumentException("rebalanceLength must be non-negative");
        }
        if (haltThreshold == null || haltThreshold.isNegative()) {
            throw new IllegalArgumentException("haltThreshold must be non-negative");
        }
        if (priceDeviationToleranceBps < 0 || rebalancePriceToleranceBps < 0) {
            throw new IllegalArgumentException("tolerances must be non-negative");
        }
    }

    public static CycleTimings defaults() {
        return new CycleTimings(Duration.ofDays(1), Duration.ofHours(1), Duration.ofHours(6), 2000, 100);
    }
}
