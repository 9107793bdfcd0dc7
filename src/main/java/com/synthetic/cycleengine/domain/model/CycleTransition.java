package com.synthetic.cycleengine.domain.model;

import java.time.Instant;

/**
 * Emitted by the orchestrator after every successful state change.
 *
 * @param snapshot present when a cycle was finalized or halted
 */
public record CycleTransition(
        String symbol,
        long cycle,
        CycleState from,
        CycleState to,
        Instant at,
        CycleSnapshot snapshot
) {
}
