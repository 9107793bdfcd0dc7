package com.synthetic.cycleengine.domain.service;

import com.synthetic.cycleengine.domain.exception.ErrorCode;
import com.synthetic.cycleengine.domain.exception.ProtocolException;
import com.synthetic.cycleengine.domain.model.CycleSnapshot;
import com.synthetic.cycleengine.domain.model.CycleState;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-pool cycle state and pool-wide aggregates.
 * <p>
 * Read by both ledgers and the orchestrator. Phase fields change only through
 * the orchestrator; the ledgers maintain the pending totals and aggregates they
 * own ({@code totalAssetShares} by the user ledger, {@code totalCommitted} by the
 * LP ledger).
 */
@Getter
public class CycleBook {

    private final String symbol;

    private long currentCycle = 1L;
    private CycleState state = CycleState.ACTIVE;
    private Instant cycleStartTime;
    private Instant offchainStartTime;
    private Instant onchainStartTime;

    private BigDecimal currentIndex = Decimals.ONE;
    private Instant lastIndexUpdateTime;
    private BigDecimal lastSettlementPrice;
    private BigDecimal settlementPrice;
    private long deviationResolvedCycle;
    /** pre-split close of the last oracle split an admin has ruled on */
    private BigDecimal acknowledgedSplitPrice;

    private BigDecimal pendingDeposits = Decimals.ZERO;
    private BigDecimal pendingDepositCollateral = Decimals.ZERO;
    private BigDecimal pendingRedemptionShares = Decimals.ZERO;
    private BigDecimal pendingRedemptionIndexWeight = BigDecimal.ZERO;
    private BigDecimal pendingLiquidityAdds = Decimals.ZERO;
    private BigDecimal pendingLiquidityReductions = Decimals.ZERO;

    private BigDecimal totalAssetShares = Decimals.ZERO;
    private BigDecimal totalCommitted = Decimals.ZERO;
    private BigDecimal claimLiability = Decimals.ZERO;
    private BigDecimal protocolFeeAccrued = Decimals.ZERO;

    private final Map<Long, BigDecimal> settlementPrices = new HashMap<>();
    private final Map<Long, BigDecimal> interestIndexes = new HashMap<>();
    private final Map<Long, BigDecimal> splitMultipliers = new HashMap<>();
    private final List<CycleSnapshot> history = new ArrayList<>();

    public CycleBook(String symbol, Instant genesis) {
        this.symbol = symbol;
        this.cycleStartTime = genesis;
        this.lastIndexUpdateTime = genesis;
        this.interestIndexes.put(0L, Decimals.ONE);
    }

    public boolean isHalted() {
        return state == CycleState.HALTED;
    }

    public void requireState(CycleState expected) {
        if (state != expected) {
            if (state == CycleState.HALTED) {
                throw ProtocolException.of(ErrorCode.POOL_HALTED, "%s", symbol);
            }
            throw ProtocolException.of(ErrorCode.INVALID_CYCLE_STATE, "%s is %s, expected %s", symbol, state, expected);
        }
    }

    public void requireNotHalted() {
        if (state == CycleState.HALTED) {
            throw ProtocolException.of(ErrorCode.POOL_HALTED, "%s", symbol);
        }
    }

    public BigDecimal settlementPriceOf(long cycle) {
        return settlementPrices.get(cycle);
    }

    public BigDecimal interestIndexOf(long cycle) {
        return interestIndexes.get(cycle);
    }

    /** Token split multiplier in force when {@code cycle} was priced. */
    public BigDecimal splitMultiplierOf(long cycle) {
        return splitMultipliers.getOrDefault(cycle, Decimals.ONE);
    }

    public List<CycleSnapshot> getHistory() {
        return Collections.unmodifiableList(history);
    }

    public Map<Long, BigDecimal> getSettlementPrices() {
        return Collections.unmodifiableMap(settlementPrices);
    }

    /** Pending deposit escrow still held for the open cycle. */
    public BigDecimal pendingDepositEscrow() {
        return pendingDeposits.add(pendingDepositCollateral);
    }

    // ledger-owned totals

    void addPendingDeposit(BigDecimal amount, BigDecimal collateral) {
        pendingDeposits = pendingDeposits.add(amount);
        pendingDepositCollateral = pendingDepositCollateral.add(collateral);
    }

    void removePendingDeposit(BigDecimal amount, BigDecimal collateral) {
        pendingDeposits = pendingDeposits.subtract(amount);
        pendingDepositCollateral = pendingDepositCollateral.subtract(collateral);
    }

    void addPendingRedemption(BigDecimal shares, BigDecimal indexSnapshot) {
        pendingRedemptionShares = pendingRedemptionShares.add(shares);
        pendingRedemptionIndexWeight = pendingRedemptionIndexWeight.add(shares.multiply(indexSnapshot));
    }

    void removePendingRedemption(BigDecimal shares, BigDecimal indexSnapshot) {
        pendingRedemptionShares = pendingRedemptionShares.subtract(shares);
        pendingRedemptionIndexWeight = pendingRedemptionIndexWeight.subtract(shares.multiply(indexSnapshot));
    }

    void addPendingLiquidityChange(BigDecimal additions, BigDecimal reductions) {
        pendingLiquidityAdds = pendingLiquidityAdds.add(additions);
        pendingLiquidityReductions = pendingLiquidityReductions.add(reductions);
    }

    void adjustTotalAssetShares(BigDecimal delta) {
        totalAssetShares = totalAssetShares.add(delta);
    }

    void adjustTotalCommitted(BigDecimal delta) {
        totalCommitted = totalCommitted.add(delta);
    }

    void adjustClaimLiability(BigDecimal delta) {
        claimLiability = Decimals.nonNegative(claimLiability.add(delta));
    }

    void addProtocolFee(BigDecimal fee) {
        protocolFeeAccrued = protocolFeeAccrued.add(fee);
    }

    BigDecimal takeProtocolFee() {
        BigDecimal fee = protocolFeeAccrued;
        protocolFeeAccrued = Decimals.ZERO;
        return fee;
    }

    // orchestrator-owned transitions

    void beginOffchain(Instant now, BigDecimal index) {
        currentIndex = index;
        lastIndexUpdateTime = now;
        interestIndexes.put(currentCycle, index);
        offchainStartTime = now;
        state = CycleState.REBALANCING_OFFCHAIN;
    }

    void markDeviationResolved() {
        deviationResolvedCycle = currentCycle;
    }

    void acknowledgeSplit(BigDecimal preSplitPrice) {
        acknowledgedSplitPrice = preSplitPrice;
    }

    boolean isSplitAcknowledged(BigDecimal preSplitPrice) {
        return acknowledgedSplitPrice != null && preSplitPrice != null
                && acknowledgedSplitPrice.compareTo(preSplitPrice) == 0;
    }

    void beginOnchain(Instant now, BigDecimal price, BigDecimal splitMultiplier) {
        settlementPrice = price;
        settlementPrices.put(currentCycle, price);
        splitMultipliers.put(currentCycle, splitMultiplier);
        onchainStartTime = now;
        state = CycleState.REBALANCING_ONCHAIN;
    }

    void finalizeCycle(Instant now, CycleSnapshot snapshot) {
        history.add(snapshot);
        lastSettlementPrice = settlementPrice;
        settlementPrice = null;
        pendingDeposits = Decimals.ZERO;
        pendingDepositCollateral = Decimals.ZERO;
        pendingRedemptionShares = Decimals.ZERO;
        pendingRedemptionIndexWeight = BigDecimal.ZERO;
        pendingLiquidityAdds = Decimals.ZERO;
        pendingLiquidityReductions = Decimals.ZERO;
        currentCycle++;
        cycleStartTime = now;
        offchainStartTime = null;
        onchainStartTime = null;
        state = CycleState.ACTIVE;
    }

    void halt(CycleSnapshot snapshot) {
        history.add(snapshot);
        state = CycleState.HALTED;
    }
}
