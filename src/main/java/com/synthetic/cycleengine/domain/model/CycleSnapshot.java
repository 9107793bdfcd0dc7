package com.synthetic.cycleengine.domain.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Immutable record of a cycle once it has left the ACTIVE phase.
 */
public record CycleSnapshot(
        long cycle,
        CycleState outcome,
        BigDecimal settlementPrice,
        BigDecimal interestIndex,
        BigDecimal depositTotal,
        BigDecimal redemptionValue,
        BigDecimal interestCollected,
        BigDecimal netFlow,
        BigDecimal totalCommitted,
        Instant startedAt,
        Instant closedAt
) {
}
