package com.synthetic.cycleengine.domain.model;

import java.math.BigDecimal;

/**
 * Outcome of one LP's settlement.
 *
 * @param netAmount    positive when the pool paid the LP, negative when the LP paid the pool
 * @param interest     interest credited to the LP for this cycle
 * @param forced       settled by an admin rather than the LP
 * @param halted       settlement was infeasible and the pool was halted instead
 * @param cycleClosed  this settlement completed the cycle
 */
public record SettlementResult(
        String liquidityProvider,
        long cycle,
        BigDecimal netAmount,
        BigDecimal interest,
        boolean forced,
        boolean halted,
        boolean cycleClosed
) {
}
