package com.synthetic.cycleengine.domain.model;

import java.math.BigDecimal;

/**
 * A user's pending intent.
 * <p>
 * For {@code DEPOSIT} the amount is in reserve units and {@code collateral} is
 * the collateral escrowed alongside it. For {@code REDEEM} and
 * {@code LIQUIDATE} the amount is in asset shares (pre-split units) and
 * {@code indexSnapshot} is the interest index of the debited position when the
 * request was made.
 *
 * @param target           liquidated account, {@code null} unless {@code LIQUIDATE}
 * @param cycle            cycle in which the request was submitted
 * @param escrow           synthetic tokens held in custody for a {@code REDEEM} or {@code LIQUIDATE}
 * @param escrowMultiplier token split multiplier when {@code escrow} was taken
 */
public record UserRequest(
        UserRequestType type,
        BigDecimal amount,
        BigDecimal collateral,
        String target,
        long cycle,
        BigDecimal indexSnapshot,
        BigDecimal escrow,
        BigDecimal escrowMultiplier
) {

    public static final UserRequest NONE =
            new UserRequest(UserRequestType.NONE, BigDecimal.ZERO, BigDecimal.ZERO, null, 0L, BigDecimal.ZERO,
                    BigDecimal.ZERO, BigDecimal.ONE);

    public static UserRequest deposit(BigDecimal amount, BigDecimal collateral, long cycle) {
        return new UserRequest(UserRequestType.DEPOSIT, amount, collateral, null, cycle, BigDecimal.ZERO,
                BigDecimal.ZERO, BigDecimal.ONE);
    }

    public static UserRequest redeem(BigDecimal shares, long cycle, BigDecimal indexSnapshot,
                                     BigDecimal escrow, BigDecimal escrowMultiplier) {
        return new UserRequest(UserRequestType.REDEEM, shares, BigDecimal.ZERO, null, cycle, indexSnapshot,
                escrow, escrowMultiplier);
    }

    public static UserRequest liquidate(String target, BigDecimal shares, long cycle, BigDecimal indexSnapshot,
                                        BigDecimal escrow, BigDecimal escrowMultiplier) {
        return new UserRequest(UserRequestType.LIQUIDATE, shares, BigDecimal.ZERO, target, cycle, indexSnapshot,
                escrow, escrowMultiplier);
    }

    public boolean isNone() {
        return type == UserRequestType.NONE;
    }
}
