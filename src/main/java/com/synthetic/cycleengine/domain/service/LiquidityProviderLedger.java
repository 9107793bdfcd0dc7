package com.synthetic.cycleengine.domain.service;

import com.synthetic.cycleengine.domain.exception.ErrorCode;
import com.synthetic.cycleengine.domain.exception.ProtocolException;
import com.synthetic.cycleengine.domain.external.AssetOracle;
import com.synthetic.cycleengine.domain.external.CapabilityService;
import com.synthetic.cycleengine.domain.external.ReserveToken;
import com.synthetic.cycleengine.domain.external.Role;
import com.synthetic.cycleengine.domain.external.SyntheticToken;
import com.synthetic.cycleengine.domain.model.CycleState;
import com.synthetic.cycleengine.domain.model.HealthStatus;
import com.synthetic.cycleengine.domain.model.LiquidityPosition;
import com.synthetic.cycleengine.domain.model.LiquidityRequest;
import com.synthetic.cycleengine.domain.model.LiquidityRequestType;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * LP-side ledger: collateral, committed liquidity, pending commitment changes,
 * accrued interest and LP liquidations.
 * <p>
 * Commitment changes are recorded as requests during the ACTIVE phase and
 * applied by the orchestrator when the cycle is finalized.
 */
@Slf4j
public class LiquidityProviderLedger {

    private final CycleBook book;
    private final ProtocolPolicy policy;
    private final PoolValuation valuation;
    private final ReserveToken reserve;
    private final CapabilityService capabilities;
    private final String custody;

    private final Map<String, LiquidityPosition> positions = new LinkedHashMap<>();
    private final Map<String, LiquidityRequest> requests = new HashMap<>();
    private final Map<String, String> liquidationInitiators = new HashMap<>();

    private BigDecimal totalCollateral = Decimals.ZERO;
    private BigDecimal totalInterestAccrued = Decimals.ZERO;

    public LiquidityProviderLedger(CycleBook book, ProtocolPolicy policy, AssetOracle oracle,
                                   SyntheticToken token, ReserveToken reserve,
                                   CapabilityService capabilities, String custody) {
        this.book = book;
        this.policy = policy;
        this.valuation = new PoolValuation(book, token, oracle);
        this.reserve = reserve;
        this.capabilities = capabilities;
        this.custody = custody;
    }

    // ---------------------------------------------------------------- collateral

    /** Registers an allow-listed LP on first deposit, tops up collateral afterwards. */
    public void deposit(String lp, BigDecimal amount) {
        requireAccount(lp);
        requirePositive(amount);
        book.requireNotHalted();
        requireRole(lp, Role.LIQUIDITY_PROVIDER);
        requireReserveBalance(lp, amount);

        reserve.transfer(lp, custody, amount);
        LiquidityPosition position = positions.computeIfAbsent(lp, k -> emptyPosition());
        credit(position, amount);
        log.info("[LPLedger] {} deposit: lp={}, amount={}, collateral={}",
                book.getSymbol(), lp, amount.toPlainString(), position.getCollateralAmount().toPlainString());
    }

    public void addCollateral(String lp, BigDecimal amount) {
        requireAccount(lp);
        requirePositive(amount);
        book.requireNotHalted();
        LiquidityPosition position = requirePosition(lp);
        requireReserveBalance(lp, amount);

        reserve.transfer(lp, custody, amount);
        credit(position, amount);
        log.info("[LPLedger] {} addCollateral: lp={}, amount={}", book.getSymbol(), lp, amount.toPlainString());
    }

    /** Withdraws collateral of an LP with nothing committed. */
    public void withdraw(String lp, BigDecimal amount) {
        requireAccount(lp);
        requirePositive(amount);
        book.requireNotHalted();
        LiquidityPosition position = requirePosition(lp);
        if (position.getLiquidityCommitment().signum() > 0) {
            throw ProtocolException.of(ErrorCode.LIQUIDITY_COMMITTED, "lp=%s", lp);
        }
        requireNoRequest(lp);
        if (position.getCollateralAmount().compareTo(amount) < 0) {
            throw ProtocolException.of(ErrorCode.INSUFFICIENT_COLLATERAL, "lp=%s has %s",
                    lp, position.getCollateralAmount().toPlainString());
        }

        debit(position, amount);
        reserve.transfer(custody, lp, amount);
        log.info("[LPLedger] {} withdraw: lp={}, amount={}", book.getSymbol(), lp, amount.toPlainString());
    }

    /** Partial reduction for a committed LP, bounded by the healthy ratio on its commitment. */
    public void reduceCollateral(String lp, BigDecimal amount) {
        requireAccount(lp);
        requirePositive(amount);
        book.requireState(CycleState.ACTIVE);
        LiquidityPosition position = requirePosition(lp);
        requireNoRequest(lp);

        BigDecimal remaining = position.getCollateralAmount().subtract(amount);
        BigDecimal required = policy.requiredCollateral(
                position.getLiquidityCommitment(), policy.parameters().lpHealthyRatio());
        if (remaining.compareTo(required) < 0) {
            throw ProtocolException.of(ErrorCode.INSUFFICIENT_COLLATERAL, "lp=%s would keep %s, requires %s",
                    lp, remaining.toPlainString(), required.toPlainString());
        }

        debit(position, amount);
        reserve.transfer(custody, lp, amount);
        log.info("[LPLedger] {} reduceCollateral: lp={}, amount={}, remaining={}",
                book.getSymbol(), lp, amount.toPlainString(), remaining.toPlainString());
    }

    // ---------------------------------------------------------------- requests

    public LiquidityRequest addLiquidity(String lp, BigDecimal amount) {
        requireAccount(lp);
        requirePositive(amount);
        book.requireState(CycleState.ACTIVE);
        requireRole(lp, Role.LIQUIDITY_PROVIDER);
        LiquidityPosition position = requirePosition(lp);
        requireNoRequest(lp);

        BigDecimal required = policy.requiredCollateral(
                position.getLiquidityCommitment().add(amount), policy.parameters().lpHealthyRatio());
        if (position.getCollateralAmount().compareTo(required) < 0) {
            throw ProtocolException.of(ErrorCode.INSUFFICIENT_COLLATERAL, "lp=%s has %s, requires %s",
                    lp, position.getCollateralAmount().toPlainString(), required.toPlainString());
        }

        LiquidityRequest request = new LiquidityRequest(
                LiquidityRequestType.ADD_LIQUIDITY, amount, null, book.getCurrentCycle());
        requests.put(lp, request);
        book.addPendingLiquidityChange(amount, Decimals.ZERO);
        log.info("[LPLedger] {} addLiquidity: lp={}, amount={}, cycle={}",
                book.getSymbol(), lp, amount.toPlainString(), request.cycle());
        return request;
    }

    public LiquidityRequest reduceLiquidity(String lp, BigDecimal amount) {
        requireAccount(lp);
        requirePositive(amount);
        book.requireState(CycleState.ACTIVE);
        LiquidityPosition position = requirePosition(lp);
        requireNoRequest(lp);

        BigDecimal reducible = position.getLiquidityCommitment().subtract(pendingLiquidationAgainst(lp));
        if (amount.compareTo(reducible) > 0) {
            throw ProtocolException.of(ErrorCode.EXCESSIVE_AMOUNT, "lp=%s can reduce at most %s",
                    lp, reducible.toPlainString());
        }
        BigDecimal available = policy.availableLiquidity(book.getTotalCommitted(),
                book.getPendingLiquidityAdds(), book.getPendingLiquidityReductions(), valuation.utilized());
        if (available.compareTo(amount) < 0) {
            throw ProtocolException.of(ErrorCode.INSUFFICIENT_LIQUIDITY, "available=%s, requested=%s",
                    available.toPlainString(), amount.toPlainString());
        }

        LiquidityRequest request = new LiquidityRequest(
                LiquidityRequestType.REDUCE_LIQUIDITY, amount, null, book.getCurrentCycle());
        requests.put(lp, request);
        book.addPendingLiquidityChange(Decimals.ZERO, amount);
        log.info("[LPLedger] {} reduceLiquidity: lp={}, amount={}, cycle={}",
                book.getSymbol(), lp, amount.toPlainString(), request.cycle());
        return request;
    }

    public void cancelRequest(String lp) {
        requireAccount(lp);
        LiquidityRequest request = requireRequest(lp);
        if (book.getState() != CycleState.ACTIVE || request.cycle() != book.getCurrentCycle()) {
            throw ProtocolException.of(ErrorCode.CANCEL_WINDOW_CLOSED, "lp=%s request cycle=%d, current=%d, state=%s",
                    lp, request.cycle(), book.getCurrentCycle(), book.getState());
        }

        switch (request.type()) {
            case ADD_LIQUIDITY -> book.addPendingLiquidityChange(request.amount().negate(), Decimals.ZERO);
            case REDUCE_LIQUIDITY -> book.addPendingLiquidityChange(Decimals.ZERO, request.amount().negate());
            case LIQUIDATE -> liquidationInitiators.remove(request.target());
            default -> { }
        }
        requests.remove(lp);
        log.info("[LPLedger] {} cancelRequest: lp={}, type={}", book.getSymbol(), lp, request.type());
    }

    /**
     * Takes over part of an unhealthy LP's commitment. Replaces a pending
     * liquidation of the same target only with a strictly larger amount.
     */
    public LiquidityRequest liquidateLP(String liquidator, String target, BigDecimal amount) {
        requireAccount(liquidator);
        requireAccount(target);
        requirePositive(amount);
        book.requireState(CycleState.ACTIVE);
        if (liquidator.equals(target)) {
            throw ProtocolException.of(ErrorCode.SELF_LIQUIDATION, "lp=%s", liquidator);
        }
        requireRole(liquidator, Role.LIQUIDITY_PROVIDER);
        LiquidityPosition liquidatorPosition = requirePosition(liquidator);
        LiquidityPosition targetPosition = requirePosition(target);
        requireNoRequest(liquidator);

        HealthStatus health = health(target);
        if (health != HealthStatus.LIQUIDATABLE) {
            throw ProtocolException.of(ErrorCode.NOT_LIQUIDATABLE, "lp=%s is %s", target, health);
        }
        BigDecimal cap = Decimals.applyBps(targetPosition.getLiquidityCommitment(),
                policy.parameters().maxLiquidationShare());
        if (amount.compareTo(cap) > 0) {
            throw ProtocolException.of(ErrorCode.EXCESSIVE_AMOUNT, "max=%s, requested=%s",
                    cap.toPlainString(), amount.toPlainString());
        }
        BigDecimal required = policy.requiredCollateral(
                liquidatorPosition.getLiquidityCommitment().add(amount), policy.parameters().lpHealthyRatio());
        if (liquidatorPosition.getCollateralAmount().compareTo(required) < 0) {
            throw ProtocolException.of(ErrorCode.INSUFFICIENT_COLLATERAL, "liquidator=%s requires %s",
                    liquidator, required.toPlainString());
        }

        String previous = liquidationInitiators.get(target);
        if (previous != null) {
            LiquidityRequest previousRequest = requests.get(previous);
            if (amount.compareTo(previousRequest.amount()) <= 0) {
                throw ProtocolException.of(ErrorCode.INVALID_LIQUIDATION, "pending=%s, requested=%s",
                        previousRequest.amount().toPlainString(), amount.toPlainString());
            }
            requests.remove(previous);
            log.info("[LPLedger] {} liquidation of {} replaced: {} -> {}", book.getSymbol(), target, previous, liquidator);
        }

        LiquidityRequest request = new LiquidityRequest(
                LiquidityRequestType.LIQUIDATE, amount, target, book.getCurrentCycle());
        requests.put(liquidator, request);
        liquidationInitiators.put(target, liquidator);
        log.info("[LPLedger] {} liquidateLP: liquidator={}, target={}, amount={}",
                book.getSymbol(), liquidator, target, amount.toPlainString());
        return request;
    }

    // ---------------------------------------------------------------- interest & exit

    public BigDecimal claimInterest(String lp) {
        requireAccount(lp);
        LiquidityPosition position = requirePosition(lp);
        BigDecimal interest = position.getInterestAccrued();
        if (interest.signum() <= 0) {
            throw ProtocolException.of(ErrorCode.NOTHING_TO_CLAIM, "lp=%s", lp);
        }

        position.setInterestAccrued(Decimals.ZERO);
        totalInterestAccrued = totalInterestAccrued.subtract(interest);
        reserve.transfer(custody, lp, interest);
        log.info("[LPLedger] {} claimInterest: lp={}, amount={}", book.getSymbol(), lp, interest.toPlainString());
        return interest;
    }

    /** Leaves the pool once nothing is committed, or unconditionally while halted. */
    public BigDecimal exitPool(String lp) {
        requireAccount(lp);
        LiquidityPosition position = requirePosition(lp);
        if (!book.isHalted()) {
            if (position.getLiquidityCommitment().signum() > 0) {
                throw ProtocolException.of(ErrorCode.LIQUIDITY_COMMITTED, "lp=%s commitment=%s",
                        lp, position.getLiquidityCommitment().toPlainString());
            }
            requireNoRequest(lp);
        }

        BigDecimal payout = position.getCollateralAmount().add(position.getInterestAccrued());
        totalCollateral = totalCollateral.subtract(position.getCollateralAmount());
        totalInterestAccrued = totalInterestAccrued.subtract(position.getInterestAccrued());
        book.adjustTotalCommitted(position.getLiquidityCommitment().negate());
        LiquidityRequest request = requests.remove(lp);
        if (request != null && request.type() == LiquidityRequestType.LIQUIDATE) {
            liquidationInitiators.remove(request.target());
        }
        positions.remove(lp);

        if (payout.signum() > 0) {
            reserve.transfer(custody, lp, payout);
        }
        log.info("[LPLedger] {} exitPool: lp={}, payout={}, halted={}",
                book.getSymbol(), lp, payout.toPlainString(), book.isHalted());
        return payout;
    }

    public BigDecimal removeLP(String admin, String lp) {
        requireAccount(admin);
        requireRole(admin, Role.ADMIN);
        return exitPool(lp);
    }

    // ---------------------------------------------------------------- reads

    public Optional<LiquidityPosition> position(String lp) {
        return Optional.ofNullable(positions.get(lp));
    }

    public LiquidityRequest request(String lp) {
        return requests.getOrDefault(lp, LiquidityRequest.NONE);
    }

    public Map<String, LiquidityPosition> positions() {
        return Collections.unmodifiableMap(positions);
    }

    /** Health of an LP against its share of the pool's synthetic notional. */
    public HealthStatus health(String lp) {
        LiquidityPosition position = requirePosition(lp);
        PolicyParameters params = policy.parameters();
        return policy.health(position.getCollateralAmount(), exposure(position),
                params.lpHealthyRatio(), params.lpLiquidationThreshold());
    }

    public BigDecimal exposure(LiquidityPosition position) {
        BigDecimal total = book.getTotalCommitted();
        if (total.signum() == 0 || position.getLiquidityCommitment().signum() == 0) {
            return Decimals.ZERO;
        }
        return Decimals.mulDivDown(valuation.notional(), position.getLiquidityCommitment(), total);
    }

    public BigDecimal totalCollateral() {
        return totalCollateral;
    }

    public BigDecimal totalInterestAccrued() {
        return totalInterestAccrued;
    }

    public BigDecimal sumOfCommitments() {
        return positions.values().stream()
                .map(LiquidityPosition::getLiquidityCommitment)
                .reduce(Decimals.ZERO, BigDecimal::add);
    }

    // ---------------------------------------------------------------- orchestrator hooks

    Map<String, BigDecimal> activeCommitments() {
        Map<String, BigDecimal> active = new LinkedHashMap<>();
        positions.forEach((lp, p) -> {
            if (p.getLiquidityCommitment().signum() > 0) {
                active.put(lp, p.getLiquidityCommitment());
            }
        });
        return active;
    }

    BigDecimal reserveBalanceOf(String lp) {
        return reserve.balanceOf(lp);
    }

    BigDecimal collateralOf(String lp) {
        return requirePosition(lp).getCollateralAmount();
    }

    void recordSettlement(String lp, long cycle, BigDecimal interest) {
        LiquidityPosition position = requirePosition(lp);
        position.setLastRebalanceCycle(cycle);
        position.setInterestAccrued(position.getInterestAccrued().add(interest));
        totalInterestAccrued = totalInterestAccrued.add(interest);
    }

    /** Books a settlement owed to the LP as collateral instead of paying it out. */
    void creditCollateral(String lp, BigDecimal amount) {
        credit(requirePosition(lp), amount);
    }

    /** Pays part of a settlement out of the LP's collateral, which stays in custody. */
    void chargeCollateral(String lp, BigDecimal amount) {
        debit(requirePosition(lp), amount);
    }

    /** Confiscates all collateral of a defaulting LP; the reserve stays in custody. */
    BigDecimal seizeCollateral(String lp) {
        LiquidityPosition position = requirePosition(lp);
        BigDecimal seized = position.getCollateralAmount();
        debit(position, seized);
        return seized;
    }

    /** Applies every request of the closing cycle; LP liquidations go first. */
    void applyPendingRequests(long cycle) {
        List<Map.Entry<String, LiquidityRequest>> due = new ArrayList<>();
        for (Map.Entry<String, LiquidityRequest> e : requests.entrySet()) {
            if (e.getValue().cycle() <= cycle) {
                due.add(Map.entry(e.getKey(), e.getValue()));
            }
        }
        due.sort((a, b) -> Boolean.compare(
                b.getValue().type() == LiquidityRequestType.LIQUIDATE,
                a.getValue().type() == LiquidityRequestType.LIQUIDATE));

        for (Map.Entry<String, LiquidityRequest> e : due) {
            String lp = e.getKey();
            LiquidityRequest request = e.getValue();
            LiquidityPosition position = positions.get(lp);
            if (position != null) {
                switch (request.type()) {
                    case ADD_LIQUIDITY -> {
                        position.setLiquidityCommitment(position.getLiquidityCommitment().add(request.amount()));
                        book.adjustTotalCommitted(request.amount());
                    }
                    case REDUCE_LIQUIDITY -> {
                        BigDecimal reduction = request.amount().min(position.getLiquidityCommitment());
                        position.setLiquidityCommitment(position.getLiquidityCommitment().subtract(reduction));
                        book.adjustTotalCommitted(reduction.negate());
                    }
                    case LIQUIDATE -> executeLiquidation(lp, position, request);
                    default -> { }
                }
            }
            requests.remove(lp);
        }
        log.info("[LPLedger] {} cycle {} applied {} LP request(s), totalCommitted={}",
                book.getSymbol(), cycle, due.size(), book.getTotalCommitted().toPlainString());
    }

    private void executeLiquidation(String liquidator, LiquidityPosition liquidatorPosition, LiquidityRequest request) {
        liquidationInitiators.remove(request.target());
        LiquidityPosition target = positions.get(request.target());
        if (target == null || target.getLiquidityCommitment().signum() == 0) {
            return;
        }
        BigDecimal amount = request.amount().min(target.getLiquidityCommitment());
        BigDecimal seized = Decimals.mulDivDown(target.getCollateralAmount(), amount, target.getLiquidityCommitment());
        BigDecimal reward = Decimals.applyBps(seized, policy.parameters().lpLiquidationReward());

        target.setLiquidityCommitment(target.getLiquidityCommitment().subtract(amount));
        target.setCollateralAmount(target.getCollateralAmount().subtract(reward));
        liquidatorPosition.setLiquidityCommitment(liquidatorPosition.getLiquidityCommitment().add(amount));
        liquidatorPosition.setCollateralAmount(liquidatorPosition.getCollateralAmount().add(reward));
        log.info("[LPLedger] {} LP liquidation: liquidator={}, target={}, amount={}, reward={}",
                book.getSymbol(), liquidator, request.target(), amount.toPlainString(), reward.toPlainString());
    }

    // ---------------------------------------------------------------- helpers

    private BigDecimal pendingLiquidationAgainst(String target) {
        String liquidator = liquidationInitiators.get(target);
        return liquidator == null ? Decimals.ZERO : requests.get(liquidator).amount();
    }

    private LiquidityPosition emptyPosition() {
        return LiquidityPosition.builder()
                .liquidityCommitment(Decimals.ZERO)
                .collateralAmount(Decimals.ZERO)
                .interestAccrued(Decimals.ZERO)
                .lastRebalanceCycle(0L)
                .build();
    }

    private void credit(LiquidityPosition position, BigDecimal amount) {
        position.setCollateralAmount(position.getCollateralAmount().add(amount));
        totalCollateral = totalCollateral.add(amount);
    }

    private void debit(LiquidityPosition position, BigDecimal amount) {
        position.setCollateralAmount(position.getCollateralAmount().subtract(amount));
        totalCollateral = totalCollateral.subtract(amount);
    }

    private LiquidityPosition requirePosition(String lp) {
        LiquidityPosition position = positions.get(lp);
        if (position == null) {
            throw ProtocolException.of(ErrorCode.LP_NOT_FOUND, "lp=%s", lp);
        }
        return position;
    }

    private LiquidityRequest requireRequest(String lp) {
        LiquidityRequest request = requests.get(lp);
        if (request == null) {
            throw ProtocolException.of(ErrorCode.NO_PENDING_REQUEST, "lp=%s", lp);
        }
        return request;
    }

    private void requireNoRequest(String lp) {
        if (requests.containsKey(lp)) {
            throw ProtocolException.of(ErrorCode.REQUEST_PENDING, "lp=%s has %s", lp, requests.get(lp).type());
        }
    }

    private void requireRole(String account, Role role) {
        if (!capabilities.hasRole(account, role)) {
            throw ProtocolException.of(ErrorCode.NOT_AUTHORIZED, "%s is not %s", account, role);
        }
    }

    private void requireReserveBalance(String account, BigDecimal amount) {
        if (reserve.balanceOf(account).compareTo(amount) < 0) {
            throw ProtocolException.of(ErrorCode.INSUFFICIENT_BALANCE, "%s has %s, needs %s",
                    account, reserve.balanceOf(account).toPlainString(), amount.toPlainString());
        }
    }

    private static void requireAccount(String account) {
        if (account == null || account.isBlank()) {
            throw new ProtocolException(ErrorCode.ZERO_ADDRESS);
        }
    }

    private static void requirePositive(BigDecimal amount) {
        if (!Decimals.isPositive(amount)) {
            throw new ProtocolException(ErrorCode.ZERO_AMOUNT);
        }
    }
}
