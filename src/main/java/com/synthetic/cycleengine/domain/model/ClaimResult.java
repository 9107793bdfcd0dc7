package com.synthetic.cycleengine.domain.model;

import java.math.BigDecimal;

/**
 * What a claim moved: synthetic minted or burned, reserve paid out and interest charged.
 */
public record ClaimResult(
        String account,
        UserRequestType type,
        long cycle,
        BigDecimal assetAmount,
        BigDecimal reservePaid,
        BigDecimal interestCharged
) {
}
