package com.synthetic.cycleengine.domain.service;

import com.synthetic.cycleengine.domain.exception.ErrorCode;
import com.synthetic.cycleengine.domain.exception.ProtocolException;
import com.synthetic.cycleengine.domain.external.AssetOracle;
import com.synthetic.cycleengine.domain.external.CapabilityService;
import com.synthetic.cycleengine.domain.external.ReserveToken;
import com.synthetic.cycleengine.domain.external.Role;
import com.synthetic.cycleengine.domain.external.SyntheticToken;
import com.synthetic.cycleengine.domain.model.CycleSnapshot;
import com.synthetic.cycleengine.domain.model.CycleState;
import com.synthetic.cycleengine.domain.model.CycleStatus;
import com.synthetic.cycleengine.domain.model.CycleTransition;
import com.synthetic.cycleengine.domain.model.SettlementResult;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Drives a pool through {@code ACTIVE -> REBALANCING_OFFCHAIN -> REBALANCING_ONCHAIN -> ACTIVE}.
 * <p>
 * The offchain transition advances the cumulative interest index; the onchain
 * transition fixes the settlement price and computes the cycle's net flow once.
 * Every active LP then settles its pro-rata share, and the last settlement
 * finalizes the cycle. An LP that cannot cover its share when forced moves the
 * pool to the terminal HALTED state.
 */
@Slf4j
public class CycleOrchestrator {

    static final BigDecimal SECONDS_PER_YEAR = BigDecimal.valueOf(31_536_000L);

    private final CycleBook book;
    private final ProtocolPolicy policy;
    private final AssetOracle oracle;
    private final SyntheticToken token;
    private final ReserveToken reserve;
    private final CapabilityService capabilities;
    private final UserLedger userLedger;
    private final LiquidityProviderLedger lpLedger;
    private final CycleTimings timings;
    private final Clock clock;
    private final String custody;
    private final PoolValuation valuation;
    private final List<CycleEventListener> listeners = new CopyOnWriteArrayList<>();

    private Settlement settlement;

    public CycleOrchestrator(CycleBook book, ProtocolPolicy policy, AssetOracle oracle, SyntheticToken token,
                             ReserveToken reserve, CapabilityService capabilities, UserLedger userLedger,
                             LiquidityProviderLedger lpLedger, CycleTimings timings, Clock clock, String custody) {
        this.book = book;
        this.policy = policy;
        this.oracle = oracle;
        this.token = token;
        this.reserve = reserve;
        this.capabilities = capabilities;
        this.userLedger = userLedger;
        this.lpLedger = lpLedger;
        this.timings = timings;
        this.clock = clock;
        this.custody = custody;
        this.valuation = new PoolValuation(book, token, oracle);
    }

    public void addListener(CycleEventListener listener) {
        listeners.add(listener);
    }

    // ---------------------------------------------------------------- phase transitions

    public void initiateOffchainRebalance() {
        book.requireState(CycleState.ACTIVE);
        Instant now = clock.instant();
        Instant due = book.getCycleStartTime().plus(timings.cycleLength());
        if (now.isBefore(due)) {
            throw ProtocolException.of(ErrorCode.CYCLE_IN_PROGRESS, "%s cycle %d ends at %s",
                    book.getSymbol(), book.getCurrentCycle(), due);
        }
        if (!oracle.isMarketOpen()) {
            throw ProtocolException.of(ErrorCode.MARKET_CLOSED, "%s", book.getSymbol());
        }

        BigDecimal index = nextIndex(now);
        book.beginOffchain(now, index);
        log.info("[Cycle] {} cycle {} -> REBALANCING_OFFCHAIN, index={}",
                book.getSymbol(), book.getCurrentCycle(), index.toPlainString());
        publish(CycleState.ACTIVE, CycleState.REBALANCING_OFFCHAIN, now, null);
    }

    public void initiateOnchainRebalance() {
        book.requireState(CycleState.REBALANCING_OFFCHAIN);
        Instant now = clock.instant();
        Instant due = book.getOffchainStartTime().plus(timings.rebalanceLength());
        if (now.isBefore(due)) {
            throw ProtocolException.of(ErrorCode.REBALANCE_IN_PROGRESS, "%s onchain phase opens at %s",
                    book.getSymbol(), due);
        }
        if (oracle.isMarketOpen()) {
            throw ProtocolException.of(ErrorCode.MARKET_OPEN, "%s", book.getSymbol());
        }
        if (!oracle.lastUpdateTimestamp().isAfter(book.getOffchainStartTime())) {
            throw ProtocolException.of(ErrorCode.ORACLE_NOT_UPDATED, "%s last update %s, offchain start %s",
                    book.getSymbol(), oracle.lastUpdateTimestamp(), book.getOffchainStartTime());
        }
        BigDecimal price = oracle.currentPrice();
        requireDeviationResolved(price);

        BigDecimal multiplier = token.splitMultiplier();
        BigDecimal redeemedAsset = book.getPendingRedemptionShares().multiply(multiplier);
        BigDecimal redemptionValue = Decimals.up(redeemedAsset.multiply(price));
        BigDecimal interestAsset = multiplier.multiply(book.getPendingRedemptionShares().multiply(book.getCurrentIndex())
                .subtract(book.getPendingRedemptionIndexWeight()));
        BigDecimal interest = Decimals.nonNegative(Decimals.down(interestAsset.multiply(price)));
        BigDecimal netFlow = book.getPendingDeposits().subtract(redemptionValue);

        Map<String, BigDecimal> active = lpLedger.activeCommitments();
        settlement = new Settlement(active, netFlow, interest, redemptionValue);
        book.beginOnchain(now, price, multiplier);
        log.info("[Cycle] {} cycle {} -> REBALANCING_ONCHAIN, price={}, netFlow={}, interest={}, lps={}",
                book.getSymbol(), book.getCurrentCycle(), price.toPlainString(), netFlow.toPlainString(),
                interest.toPlainString(), active.size());
        publish(CycleState.REBALANCING_OFFCHAIN, CycleState.REBALANCING_ONCHAIN, now, null);

        if (active.isEmpty()) {
            log.info("[Cycle] {} cycle {} has no active LP, finalizing", book.getSymbol(), book.getCurrentCycle());
            finalizeCycle(now);
        }
    }

    /**
     * Accepts a price move beyond tolerance for the current cycle. A split must
     * be confirmed by the oracle at exactly {@code ratioNum:ratioDen} and is
     * applied to the synthetic token.
     */
    public void resolvePriceDeviation(String admin, boolean isSplit, long ratioNum, long ratioDen) {
        requireRole(admin, Role.ADMIN);
        book.requireState(CycleState.REBALANCING_OFFCHAIN);
        if (book.getDeviationResolvedCycle() == book.getCurrentCycle()) {
            throw ProtocolException.of(ErrorCode.DEVIATION_ALREADY_RESOLVED, "%s cycle %d",
                    book.getSymbol(), book.getCurrentCycle());
        }
        if (isSplit) {
            if (ratioNum <= 0 || ratioDen <= 0 || !oracle.verifySplit(ratioNum, ratioDen)) {
                throw ProtocolException.of(ErrorCode.INVALID_SPLIT, "%s ratio %d:%d",
                        book.getSymbol(), ratioNum, ratioDen);
            }
            token.applySplit(ratioNum, ratioDen);
            log.warn("[Cycle] {} split {}:{} applied, multiplier={}",
                    book.getSymbol(), ratioNum, ratioDen, token.splitMultiplier().toPlainString());
        }
        if (oracle.splitDetected()) {
            book.acknowledgeSplit(oracle.preSplitPrice());
        }
        book.markDeviationResolved();
        log.warn("[Cycle] {} price deviation resolved by {} for cycle {} (split={})",
                book.getSymbol(), admin, book.getCurrentCycle(), isSplit);
    }

    // ---------------------------------------------------------------- LP settlement

    /** Settles the LP's share in whichever direction the cycle's net flow requires. */
    public SettlementResult rebalancePool(String lp, BigDecimal price) {
        Instant now = clock.instant();
        BigDecimal share = prepareSettlement(lp, price);
        moveFunds(lp, share);
        return completeSettlement(lp, share, false, now);
    }

    /**
     * Explicit form: the declared amount and direction must equal the computed
     * obligation exactly.
     *
     * @param isContribution true when the LP pays the pool
     */
    public SettlementResult rebalancePool(String lp, BigDecimal price, BigDecimal amount, boolean isContribution) {
        Instant now = clock.instant();
        if (amount == null || amount.signum() < 0) {
            throw new ProtocolException(ErrorCode.ZERO_AMOUNT);
        }
        BigDecimal share = prepareSettlement(lp, price);
        BigDecimal declared = isContribution ? amount.negate() : amount;
        if (declared.compareTo(share) != 0) {
            throw ProtocolException.of(ErrorCode.REBALANCE_MISMATCH, "lp=%s declared=%s, obligation=%s",
                    lp, declared.toPlainString(), share.toPlainString());
        }
        moveFunds(lp, share);
        return completeSettlement(lp, share, false, now);
    }

    /**
     * Settles an LP that missed the onchain window out of its collateral. If the
     * collateral cannot cover the obligation it is seized and the pool halts.
     */
    public SettlementResult forceRebalanceLP(String admin, String lp) {
        requireRole(admin, Role.ADMIN);
        book.requireState(CycleState.REBALANCING_ONCHAIN);
        Instant now = clock.instant();
        Instant due = book.getOnchainStartTime().plus(timings.haltThreshold());
        if (now.isBefore(due)) {
            throw ProtocolException.of(ErrorCode.HALT_THRESHOLD_NOT_REACHED, "%s force allowed from %s",
                    book.getSymbol(), due);
        }
        requireUnsettled(lp);
        BigDecimal share = settlement.shareOf(lp);

        if (share.signum() >= 0) {
            lpLedger.creditCollateral(lp, share);
        } else {
            BigDecimal obligation = share.negate();
            BigDecimal collateral = lpLedger.collateralOf(lp);
            if (collateral.compareTo(obligation) < 0) {
                return haltPool(lp, obligation, collateral, now);
            }
            lpLedger.chargeCollateral(lp, obligation);
        }
        log.warn("[Cycle] {} forced settlement of {} by {}: net={}", book.getSymbol(), lp, admin, share.toPlainString());
        return completeSettlement(lp, share, true, now);
    }

    public BigDecimal collectProtocolFee(String admin, String recipient) {
        requireRole(admin, Role.ADMIN);
        if (recipient == null || recipient.isBlank()) {
            throw new ProtocolException(ErrorCode.ZERO_ADDRESS);
        }
        if (book.getProtocolFeeAccrued().signum() == 0) {
            throw ProtocolException.of(ErrorCode.NOTHING_TO_CLAIM, "%s protocol fee", book.getSymbol());
        }
        BigDecimal fee = book.takeProtocolFee();
        reserve.transfer(custody, recipient, fee);
        log.info("[Cycle] {} protocol fee {} collected to {}", book.getSymbol(), fee.toPlainString(), recipient);
        return fee;
    }

    // ---------------------------------------------------------------- reads

    public CycleStatus status() {
        return CycleStatus.builder()
                .symbol(book.getSymbol())
                .cycle(book.getCurrentCycle())
                .state(book.getState())
                .cycleStartTime(book.getCycleStartTime())
                .offchainStartTime(book.getOffchainStartTime())
                .onchainStartTime(book.getOnchainStartTime())
                .settlementPrice(book.getSettlementPrice())
                .lastSettlementPrice(book.getLastSettlementPrice())
                .interestIndex(book.getCurrentIndex())
                .pendingDeposits(book.getPendingDeposits())
                .pendingRedemptions(valuation.toAsset(book.getPendingRedemptionShares()))
                .totalCommitted(book.getTotalCommitted())
                .splitMultiplier(token.splitMultiplier())
                .activeLiquidityProviders(settlement == null
                        ? lpLedger.activeCommitments().size() : settlement.commitments.size())
                .settledLiquidityProviders(settlement == null ? 0 : settlement.settled.size())
                .build();
    }

    /** Whether the keeper may attempt the next transition now. */
    public boolean isTransitionDue() {
        Instant now = clock.instant();
        return switch (book.getState()) {
            case ACTIVE -> !now.isBefore(book.getCycleStartTime().plus(timings.cycleLength()));
            case REBALANCING_OFFCHAIN -> !now.isBefore(book.getOffchainStartTime().plus(timings.rebalanceLength()));
            default -> false;
        };
    }

    public Set<String> unsettledLiquidityProviders() {
        if (settlement == null) {
            return Collections.emptySet();
        }
        Set<String> pending = new HashSet<>(settlement.commitments.keySet());
        pending.removeAll(settlement.settled);
        return pending;
    }

    // ---------------------------------------------------------------- internals

    /** {@code idx * (1 + rate * dt / YEAR)} with the rate taken from current utilization, rounded up. */
    BigDecimal nextIndex(Instant now) {
        long seconds = Math.max(0L, Duration.between(book.getLastIndexUpdateTime(), now).getSeconds());
        long utilization = policy.utilization(valuation.notional(), book.getTotalCommitted());
        long rateBps = policy.interestRate(utilization);
        BigDecimal growth = book.getCurrentIndex()
                .multiply(BigDecimal.valueOf(rateBps))
                .multiply(BigDecimal.valueOf(seconds))
                .divide(Decimals.BPS_DECIMAL.multiply(SECONDS_PER_YEAR), Decimals.SCALE, RoundingMode.UP);
        return book.getCurrentIndex().add(growth);
    }

    private void requireDeviationResolved(BigDecimal price) {
        if (book.getDeviationResolvedCycle() == book.getCurrentCycle()) {
            return;
        }
        if (oracle.splitDetected() && !book.isSplitAcknowledged(oracle.preSplitPrice())) {
            throw ProtocolException.of(ErrorCode.PRICE_DEVIATION_HIGH, "%s oracle reports a split from %s",
                    book.getSymbol(), oracle.preSplitPrice().toPlainString());
        }
        BigDecimal last = book.getLastSettlementPrice();
        if (last == null) {
            return;
        }
        BigDecimal deviationBps = price.subtract(last).abs()
                .multiply(Decimals.BPS_DECIMAL)
                .divide(last, 0, RoundingMode.UP);
        if (deviationBps.compareTo(BigDecimal.valueOf(timings.priceDeviationToleranceBps())) > 0) {
            throw ProtocolException.of(ErrorCode.PRICE_DEVIATION_HIGH, "%s moved %s bps from %s to %s",
                    book.getSymbol(), deviationBps.toPlainString(), last.toPlainString(), price.toPlainString());
        }
    }

    private BigDecimal prepareSettlement(String lp, BigDecimal price) {
        book.requireState(CycleState.REBALANCING_ONCHAIN);
        requireUnsettled(lp);
        if (price == null || price.signum() <= 0) {
            throw ProtocolException.of(ErrorCode.PRICE_NOT_IN_RANGE, "price must be positive");
        }
        BigDecimal settlementPrice = book.getSettlementPrice();
        BigDecimal band = Decimals.applyBps(settlementPrice, timings.rebalancePriceToleranceBps());
        if (price.subtract(settlementPrice).abs().compareTo(band) > 0) {
            throw ProtocolException.of(ErrorCode.PRICE_NOT_IN_RANGE, "quoted %s, settlement %s",
                    price.toPlainString(), settlementPrice.toPlainString());
        }
        BigDecimal share = settlement.shareOf(lp);
        if (share.signum() < 0 && lpLedger.reserveBalanceOf(lp).compareTo(share.negate()) < 0) {
            throw ProtocolException.of(ErrorCode.INSUFFICIENT_BALANCE, "lp=%s owes %s",
                    lp, share.negate().toPlainString());
        }
        if (share.signum() > 0 && reserve.balanceOf(custody).compareTo(share) < 0) {
            throw ProtocolException.of(ErrorCode.INSUFFICIENT_BALANCE, "pool custody cannot pay %s",
                    share.toPlainString());
        }
        return share;
    }

    private void requireUnsettled(String lp) {
        if (lp == null || !settlement.commitments.containsKey(lp)) {
            throw ProtocolException.of(ErrorCode.NOT_ACTIVE_LP, "lp=%s, cycle=%d", lp, book.getCurrentCycle());
        }
        if (settlement.settled.contains(lp)) {
            throw ProtocolException.of(ErrorCode.ALREADY_REBALANCED, "lp=%s, cycle=%d", lp, book.getCurrentCycle());
        }
    }

    private void moveFunds(String lp, BigDecimal share) {
        if (share.signum() > 0) {
            reserve.transfer(custody, lp, share);
        } else if (share.signum() < 0) {
            reserve.transfer(lp, custody, share.negate());
        }
    }

    private SettlementResult completeSettlement(String lp, BigDecimal share, boolean forced, Instant now) {
        long cycle = book.getCurrentCycle();
        BigDecimal grossInterest = settlement.interestOf(lp);
        BigDecimal fee = Decimals.applyBps(grossInterest, policy.parameters().protocolFee());
        BigDecimal credited = grossInterest.subtract(fee);

        lpLedger.recordSettlement(lp, cycle, credited);
        book.addProtocolFee(fee);
        settlement.markSettled(lp, share, grossInterest);
        log.info("[Cycle] {} cycle {} LP {} settled: net={}, interest={}, fee={} ({}/{})",
                book.getSymbol(), cycle, lp, share.toPlainString(), credited.toPlainString(), fee.toPlainString(),
                settlement.settled.size(), settlement.commitments.size());

        boolean closed = settlement.isComplete();
        if (closed) {
            finalizeCycle(now);
        }
        return new SettlementResult(lp, cycle, share, credited, forced, false, closed);
    }

    private SettlementResult haltPool(String lp, BigDecimal obligation, BigDecimal collateral, Instant now) {
        long cycle = book.getCurrentCycle();
        BigDecimal seized = lpLedger.seizeCollateral(lp);
        CycleSnapshot snapshot = snapshot(CycleState.HALTED, now);
        settlement = null;
        book.halt(snapshot);
        log.error("[Cycle] {} HALTED in cycle {}: lp={} owed {} with collateral {}, seized {}",
                book.getSymbol(), cycle, lp, obligation.toPlainString(), collateral.toPlainString(),
                seized.toPlainString());
        publish(CycleState.REBALANCING_ONCHAIN, CycleState.HALTED, now, snapshot);
        return new SettlementResult(lp, cycle, obligation.negate(), Decimals.ZERO, true, true, false);
    }

    private void finalizeCycle(Instant now) {
        long cycle = book.getCurrentCycle();
        lpLedger.applyPendingRequests(cycle);
        userLedger.settleCycle(cycle, book.getSettlementPrice(), settlement.redemptionValue, settlement.interest);
        CycleSnapshot snapshot = snapshot(CycleState.ACTIVE, now);
        settlement = null;
        book.finalizeCycle(now, snapshot);
        log.info("[Cycle] {} cycle {} finalized, cycle {} ACTIVE, totalCommitted={}",
                book.getSymbol(), cycle, book.getCurrentCycle(), book.getTotalCommitted().toPlainString());
        publish(CycleState.REBALANCING_ONCHAIN, CycleState.ACTIVE, now, snapshot);
    }

    private CycleSnapshot snapshot(CycleState outcome, Instant now) {
        return new CycleSnapshot(
                book.getCurrentCycle(),
                outcome,
                book.getSettlementPrice(),
                book.getCurrentIndex(),
                book.getPendingDeposits(),
                settlement.redemptionValue,
                settlement.interest,
                settlement.netFlow,
                book.getTotalCommitted(),
                book.getCycleStartTime(),
                now);
    }

    private void publish(CycleState from, CycleState to, Instant at, CycleSnapshot snapshot) {
        long cycle = snapshot != null ? snapshot.cycle() : book.getCurrentCycle();
        CycleTransition transition = new CycleTransition(book.getSymbol(), cycle, from, to, at, snapshot);
        for (CycleEventListener listener : listeners) {
            try {
                listener.onTransition(transition);
            } catch (RuntimeException e) {
                log.warn("[Cycle] {} listener {} failed on {} -> {}",
                        book.getSymbol(), listener.getClass().getSimpleName(), from, to, e);
            }
        }
    }

    private void requireRole(String account, Role role) {
        if (account == null || account.isBlank()) {
            throw new ProtocolException(ErrorCode.ZERO_ADDRESS);
        }
        if (!capabilities.hasRole(account, role)) {
            throw ProtocolException.of(ErrorCode.NOT_AUTHORIZED, "%s is not %s", account, role);
        }
    }

    /**
     * Net flow and interest of the cycle being settled, split pro rata over the
     * commitments snapshotted at the onchain transition. The last LP takes the
     * rounding remainder.
     */
    private static final class Settlement {

        private final Map<String, BigDecimal> commitments;
        private final BigDecimal totalCommitted;
        private final BigDecimal netFlow;
        private final BigDecimal interest;
        private final BigDecimal redemptionValue;
        private final Set<String> settled = new HashSet<>();

        private BigDecimal remainingNetFlow;
        private BigDecimal remainingInterest;

        private Settlement(Map<String, BigDecimal> commitments, BigDecimal netFlow,
                           BigDecimal interest, BigDecimal redemptionValue) {
            this.commitments = new LinkedHashMap<>(commitments);
            this.totalCommitted = commitments.values().stream().reduce(Decimals.ZERO, BigDecimal::add);
            this.netFlow = netFlow;
            this.interest = interest;
            this.redemptionValue = redemptionValue;
            this.remainingNetFlow = netFlow;
            this.remainingInterest = interest;
        }

        private boolean isLast() {
            return settled.size() == commitments.size() - 1;
        }

        BigDecimal shareOf(String lp) {
            if (isLast()) {
                return remainingNetFlow;
            }
            return Decimals.mulDivDown(netFlow, commitments.get(lp), totalCommitted);
        }

        BigDecimal interestOf(String lp) {
            if (isLast()) {
                return remainingInterest;
            }
            return Decimals.mulDivDown(interest, commitments.get(lp), totalCommitted);
        }

        void markSettled(String lp, BigDecimal share, BigDecimal grossInterest) {
            settled.add(lp);
            remainingNetFlow = remainingNetFlow.subtract(share);
            remainingInterest = remainingInterest.subtract(grossInterest);
        }

        boolean isComplete() {
            return settled.size() == commitments.size();
        }
    }
}
