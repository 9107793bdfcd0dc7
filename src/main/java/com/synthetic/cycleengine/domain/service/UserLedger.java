package com.synthetic.cycleengine.domain.service;

import com.synthetic.cycleengine.domain.exception.ErrorCode;
import com.synthetic.cycleengine.domain.exception.ProtocolException;
import com.synthetic.cycleengine.domain.external.AssetOracle;
import com.synthetic.cycleengine.domain.external.ReserveToken;
import com.synthetic.cycleengine.domain.external.SyntheticToken;
import com.synthetic.cycleengine.domain.model.ClaimResult;
import com.synthetic.cycleengine.domain.model.CycleState;
import com.synthetic.cycleengine.domain.model.HealthStatus;
import com.synthetic.cycleengine.domain.model.UserPosition;
import com.synthetic.cycleengine.domain.model.UserRequest;
import com.synthetic.cycleengine.domain.model.UserRequestType;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * User-side ledger.
 * <p>
 * Deposits, redemptions and liquidations are escrowed as requests during the
 * ACTIVE phase and settled in bulk by the orchestrator; each user then claims
 * against the fixed price and interest index of the cycle the request belongs
 * to. Interest debt is derived from the cumulative index, so settlement never
 * walks the user set.
 */
@Slf4j
public class UserLedger {

    private final CycleBook book;
    private final ProtocolPolicy policy;
    private final PoolValuation valuation;
    private final SyntheticToken token;
    private final ReserveToken reserve;
    private final LiquidityProviderLedger lpLedger;
    private final String custody;

    private final Map<String, UserPosition> positions = new LinkedHashMap<>();
    private final Map<String, UserRequest> requests = new HashMap<>();
    /** target -> liquidator with a liquidation pending in the open cycle */
    private final Map<String, String> liquidationInitiators = new HashMap<>();
    /** target -> shares already settled for liquidators but not yet claimed */
    private final Map<String, BigDecimal> settledLiquidationShares = new HashMap<>();

    public UserLedger(CycleBook book, ProtocolPolicy policy, AssetOracle oracle, SyntheticToken token,
                      ReserveToken reserve, LiquidityProviderLedger lpLedger, String custody) {
        this.book = book;
        this.policy = policy;
        this.valuation = new PoolValuation(book, token, oracle);
        this.token = token;
        this.reserve = reserve;
        this.lpLedger = lpLedger;
        this.custody = custody;
    }

    // ---------------------------------------------------------------- requests

    public UserRequest depositRequest(String user, BigDecimal amount, BigDecimal collateral) {
        requireAccount(user);
        requirePositive(amount);
        if (collateral == null || collateral.signum() < 0) {
            throw new ProtocolException(ErrorCode.ZERO_AMOUNT, "collateral must not be negative");
        }
        book.requireState(CycleState.ACTIVE);
        requireNoRequest(user);

        BigDecimal required = policy.requiredCollateral(amount, policy.parameters().userHealthyRatio());
        if (collateral.compareTo(required) < 0) {
            throw ProtocolException.of(ErrorCode.INSUFFICIENT_COLLATERAL, "provided=%s, required=%s",
                    collateral.toPlainString(), required.toPlainString());
        }
        BigDecimal available = policy.availableLiquidity(book.getTotalCommitted(),
                book.getPendingLiquidityAdds(), book.getPendingLiquidityReductions(), valuation.utilized());
        if (available.compareTo(amount) < 0) {
            throw ProtocolException.of(ErrorCode.INSUFFICIENT_LIQUIDITY, "available=%s, requested=%s",
                    available.toPlainString(), amount.toPlainString());
        }
        BigDecimal escrow = amount.add(collateral);
        requireReserveBalance(user, escrow);

        reserve.transfer(user, custody, escrow);
        UserRequest request = UserRequest.deposit(amount, collateral, book.getCurrentCycle());
        requests.put(user, request);
        book.addPendingDeposit(amount, collateral);
        log.info("[UserLedger] {} depositRequest: user={}, amount={}, collateral={}, cycle={}",
                book.getSymbol(), user, amount.toPlainString(), collateral.toPlainString(), request.cycle());
        return request;
    }

    public UserRequest redemptionRequest(String user, BigDecimal amount) {
        requireAccount(user);
        requirePositive(amount);
        book.requireState(CycleState.ACTIVE);
        requireNoRequest(user);
        requireTokenBalance(user, amount);
        UserPosition position = requirePosition(user);

        BigDecimal shares = valuation.toShares(amount);
        BigDecimal redeemable = position.getAssetShares().subtract(liquidationsAgainst(user));
        if (shares.compareTo(redeemable) > 0) {
            throw ProtocolException.of(ErrorCode.INSUFFICIENT_POSITION, "redeemable=%s, requested=%s",
                    valuation.toAsset(redeemable).toPlainString(), amount.toPlainString());
        }

        token.transfer(user, custody, amount);
        UserRequest request = UserRequest.redeem(shares, book.getCurrentCycle(), position.getInterestIndex(),
                amount, token.splitMultiplier());
        requests.put(user, request);
        book.addPendingRedemption(shares, position.getInterestIndex());
        log.info("[UserLedger] {} redemptionRequest: user={}, amount={}, cycle={}",
                book.getSymbol(), user, amount.toPlainString(), request.cycle());
        return request;
    }

    /**
     * Repays part of an unhealthy position with the liquidator's tokens. Only a
     * strictly larger request replaces a pending liquidation of the same
     * target; the replaced liquidator gets the escrowed tokens back.
     */
    public UserRequest liquidationRequest(String liquidator, String target, BigDecimal amount) {
        requireAccount(liquidator);
        requireAccount(target);
        requirePositive(amount);
        book.requireState(CycleState.ACTIVE);
        if (liquidator.equals(target)) {
            throw ProtocolException.of(ErrorCode.SELF_LIQUIDATION, "user=%s", liquidator);
        }
        requireNoRequest(liquidator);
        UserPosition position = requirePosition(target);

        HealthStatus health = health(target);
        if (health != HealthStatus.LIQUIDATABLE) {
            throw ProtocolException.of(ErrorCode.NOT_LIQUIDATABLE, "user=%s is %s", target, health);
        }
        BigDecimal shares = valuation.toShares(amount);
        BigDecimal cap = Decimals.applyBps(position.getAssetShares(), policy.parameters().maxLiquidationShare());
        if (shares.compareTo(cap) > 0) {
            throw ProtocolException.of(ErrorCode.EXCESSIVE_AMOUNT, "max=%s, requested=%s",
                    valuation.toAsset(cap).toPlainString(), amount.toPlainString());
        }
        BigDecimal available = position.getAssetShares()
                .subtract(pendingRedemptionOf(target))
                .subtract(settledLiquidationShares.getOrDefault(target, Decimals.ZERO));
        if (shares.compareTo(available) > 0) {
            throw ProtocolException.of(ErrorCode.INSUFFICIENT_POSITION, "user=%s", target);
        }
        requireTokenBalance(liquidator, amount);

        String previous = liquidationInitiators.get(target);
        UserRequest previousRequest = previous == null ? null : requests.get(previous);
        if (previousRequest != null && shares.compareTo(previousRequest.amount()) <= 0) {
            throw ProtocolException.of(ErrorCode.INVALID_LIQUIDATION, "pending=%s, requested=%s",
                    valuation.toAsset(previousRequest.amount()).toPlainString(), amount.toPlainString());
        }

        if (previousRequest != null) {
            token.transfer(custody, previous, escrowedTokens(previousRequest));
            requests.remove(previous);
            book.removePendingRedemption(previousRequest.amount(), previousRequest.indexSnapshot());
            log.info("[UserLedger] {} liquidation of {} replaced: {} refunded, {} takes over",
                    book.getSymbol(), target, previous, liquidator);
        }
        token.transfer(liquidator, custody, amount);
        UserRequest request = UserRequest.liquidate(target, shares, book.getCurrentCycle(), position.getInterestIndex(),
                amount, token.splitMultiplier());
        requests.put(liquidator, request);
        liquidationInitiators.put(target, liquidator);
        book.addPendingRedemption(shares, position.getInterestIndex());
        log.info("[UserLedger] {} liquidationRequest: liquidator={}, target={}, amount={}",
                book.getSymbol(), liquidator, target, amount.toPlainString());
        return request;
    }

    /**
     * Refunds the escrow of a request that has not been settled. Allowed in the
     * submission cycle while ACTIVE, and for the unfinished cycle once HALTED.
     */
    public void cancelRequest(String user) {
        requireAccount(user);
        UserRequest request = requireRequest(user);
        boolean openPhase = book.getState() == CycleState.ACTIVE || book.isHalted();
        if (!openPhase || request.cycle() != book.getCurrentCycle()) {
            throw ProtocolException.of(ErrorCode.CANCEL_WINDOW_CLOSED, "request cycle=%d, current=%d, state=%s",
                    request.cycle(), book.getCurrentCycle(), book.getState());
        }

        if (request.type() == UserRequestType.DEPOSIT) {
            BigDecimal escrow = request.amount().add(request.collateral());
            requireReserveBalance(custody, escrow);
            reserve.transfer(custody, user, escrow);
            book.removePendingDeposit(request.amount(), request.collateral());
        } else {
            token.transfer(custody, user, escrowedTokens(request));
            book.removePendingRedemption(request.amount(), request.indexSnapshot());
            if (request.type() == UserRequestType.LIQUIDATE) {
                liquidationInitiators.remove(request.target());
            }
        }
        requests.remove(user);
        log.info("[UserLedger] {} cancelRequest: user={}, type={}", book.getSymbol(), user, request.type());
    }

    // ---------------------------------------------------------------- claims

    public ClaimResult claimAsset(String user) {
        requireAccount(user);
        UserRequest request = requests.get(user);
        if (request == null || request.type() != UserRequestType.DEPOSIT) {
            throw ProtocolException.of(ErrorCode.NOTHING_TO_CLAIM, "user=%s", user);
        }
        requireSettled(request);

        BigDecimal price = book.settlementPriceOf(request.cycle());
        BigDecimal cycleIndex = book.interestIndexOf(request.cycle());
        BigDecimal shares = Decimals.divDown(Decimals.divDown(request.amount(), price),
                book.splitMultiplierOf(request.cycle()));
        BigDecimal assetAmount = valuation.toAsset(shares);

        token.mint(user, assetAmount);
        UserPosition position = positions.computeIfAbsent(user, k -> emptyPosition());
        position.setInterestIndex(weightedIndex(position.getAssetShares(), position.getInterestIndex(), shares, cycleIndex));
        position.setAssetShares(position.getAssetShares().add(shares));
        position.setReserveAmount(position.getReserveAmount().add(request.amount()));
        position.setCollateralAmount(position.getCollateralAmount().add(request.collateral()));
        requests.remove(user);

        log.info("[UserLedger] {} claimAsset: user={}, cycle={}, price={}, minted={}",
                book.getSymbol(), user, request.cycle(), price.toPlainString(), assetAmount.toPlainString());
        return new ClaimResult(user, UserRequestType.DEPOSIT, request.cycle(), assetAmount, Decimals.ZERO, Decimals.ZERO);
    }

    /**
     * Pays out a settled redemption or liquidation. A redeemer receives the
     * asset value minus interest plus the released share of collateral; a
     * liquidator receives the same computed against the target's position.
     */
    public ClaimResult claimReserve(String user) {
        requireAccount(user);
        UserRequest request = requests.get(user);
        if (request == null || (request.type() != UserRequestType.REDEEM && request.type() != UserRequestType.LIQUIDATE)) {
            throw ProtocolException.of(ErrorCode.NOTHING_TO_CLAIM, "user=%s", user);
        }
        requireSettled(request);

        String owner = request.type() == UserRequestType.REDEEM ? user : request.target();
        UserPosition position = requirePosition(owner);
        BigDecimal price = book.settlementPriceOf(request.cycle());
        BigDecimal cycleIndex = book.interestIndexOf(request.cycle());

        BigDecimal settledAsset = Decimals.mulDown(request.amount(), book.splitMultiplierOf(request.cycle()));
        BigDecimal assetAmount = escrowedTokens(request);
        BigDecimal gross = Decimals.mulDown(settledAsset, price);
        BigDecimal interest = interestCharge(settledAsset, request.indexSnapshot(), cycleIndex, price);
        BigDecimal sharesTaken = request.amount().min(position.getAssetShares());
        BigDecimal releasedCollateral = proportion(position.getCollateralAmount(), sharesTaken, position.getAssetShares());
        BigDecimal releasedPrincipal = proportion(position.getReserveAmount(), sharesTaken, position.getAssetShares());
        BigDecimal payout = Decimals.nonNegative(gross.subtract(interest).add(releasedCollateral));
        requireReserveBalance(custody, payout);

        token.burn(custody, assetAmount);
        position.setAssetShares(position.getAssetShares().subtract(sharesTaken));
        position.setCollateralAmount(position.getCollateralAmount().subtract(releasedCollateral));
        position.setReserveAmount(position.getReserveAmount().subtract(releasedPrincipal));
        if (position.isEmpty()) {
            positions.remove(owner);
        }
        if (request.type() == UserRequestType.LIQUIDATE) {
            settledLiquidationShares.computeIfPresent(owner, (k, v) -> {
                BigDecimal left = v.subtract(request.amount());
                return left.signum() > 0 ? left : null;
            });
        }
        book.adjustClaimLiability(gross.subtract(interest).negate());
        requests.remove(user);
        if (payout.signum() > 0) {
            reserve.transfer(custody, user, payout);
        }

        log.info("[UserLedger] {} claimReserve: user={}, type={}, cycle={}, gross={}, interest={}, paid={}",
                book.getSymbol(), user, request.type(), request.cycle(),
                gross.toPlainString(), interest.toPlainString(), payout.toPlainString());
        return new ClaimResult(user, request.type(), request.cycle(), assetAmount, payout, interest);
    }

    // ---------------------------------------------------------------- collateral & exit

    public void addCollateral(String user, BigDecimal amount) {
        requireAccount(user);
        requirePositive(amount);
        book.requireNotHalted();
        UserPosition position = requirePosition(user);
        requireReserveBalance(user, amount);

        reserve.transfer(user, custody, amount);
        position.setCollateralAmount(position.getCollateralAmount().add(amount));
        log.info("[UserLedger] {} addCollateral: user={}, amount={}", book.getSymbol(), user, amount.toPlainString());
    }

    public void reduceCollateral(String user, BigDecimal amount) {
        requireAccount(user);
        requirePositive(amount);
        book.requireNotHalted();
        UserPosition position = requirePosition(user);
        UserRequest pending = requests.get(user);
        if (pending != null && pending.cycle() >= book.getCurrentCycle()) {
            throw ProtocolException.of(ErrorCode.REQUEST_PENDING, "user=%s has an unsettled %s",
                    user, pending.type());
        }

        BigDecimal remaining = position.getCollateralAmount().subtract(amount);
        BigDecimal required = policy.requiredCollateral(valuation.value(position.getAssetShares()),
                policy.parameters().userHealthyRatio()).add(interestDebt(position));
        if (remaining.compareTo(required) < 0) {
            throw ProtocolException.of(ErrorCode.INSUFFICIENT_COLLATERAL, "would keep %s, requires %s",
                    remaining.toPlainString(), required.toPlainString());
        }

        position.setCollateralAmount(remaining);
        reserve.transfer(custody, user, amount);
        log.info("[UserLedger] {} reduceCollateral: user={}, amount={}, remaining={}",
                book.getSymbol(), user, amount.toPlainString(), remaining.toPlainString());
    }

    /**
     * Halted-pool exit: burns {@code amount} tokens for the same fraction of the
     * reserve left to token holders, outside the cycle mechanism. A user with a
     * position also gets back the collateral backing the burned part of it.
     */
    public BigDecimal exitPool(String user, BigDecimal amount) {
        requireAccount(user);
        requirePositive(amount);
        if (!book.isHalted()) {
            throw ProtocolException.of(ErrorCode.POOL_NOT_HALTED, "%s is %s", book.getSymbol(), book.getState());
        }
        requireTokenBalance(user, amount);

        BigDecimal circulating = token.totalSupply().subtract(token.balanceOf(custody));
        if (circulating.signum() <= 0) {
            throw ProtocolException.of(ErrorCode.INSUFFICIENT_BALANCE, "no circulating supply");
        }
        BigDecimal share = Decimals.mulDivDown(amount, haltedUserReserve(), circulating);

        UserPosition position = positions.get(user);
        BigDecimal shares = Decimals.ZERO;
        BigDecimal collateral = Decimals.ZERO;
        BigDecimal principal = Decimals.ZERO;
        if (position != null && position.getAssetShares().signum() > 0) {
            shares = valuation.toShares(amount).min(position.getAssetShares());
            collateral = proportion(position.getCollateralAmount(), shares, position.getAssetShares());
            principal = proportion(position.getReserveAmount(), shares, position.getAssetShares());
        }
        BigDecimal payout = share.add(collateral);
        requireReserveBalance(custody, payout);

        token.burn(user, amount);
        if (shares.signum() > 0) {
            position.setAssetShares(position.getAssetShares().subtract(shares));
            position.setCollateralAmount(position.getCollateralAmount().subtract(collateral));
            position.setReserveAmount(position.getReserveAmount().subtract(principal));
            book.adjustTotalAssetShares(shares.negate());
            if (position.isEmpty()) {
                positions.remove(user);
            }
        }
        if (payout.signum() > 0) {
            reserve.transfer(custody, user, payout);
        }
        log.warn("[UserLedger] {} exitPool: user={}, burned={}, share={}, collateral={}",
                book.getSymbol(), user, amount.toPlainString(), share.toPlainString(), collateral.toPlainString());
        return payout;
    }

    /**
     * Custody reserve shared by all token holders once the pool is halted.
     * Collateral posted by users stays with its owner and is not part of it.
     */
    public BigDecimal haltedUserReserve() {
        BigDecimal reserved = lpLedger.totalCollateral()
                .add(totalUserCollateral())
                .add(lpLedger.totalInterestAccrued())
                .add(book.getProtocolFeeAccrued())
                .add(book.pendingDepositEscrow())
                .add(book.getClaimLiability());
        return Decimals.nonNegative(reserve.balanceOf(custody).subtract(reserved));
    }

    // ---------------------------------------------------------------- reads

    public Optional<UserPosition> position(String user) {
        return Optional.ofNullable(positions.get(user));
    }

    public UserRequest request(String user) {
        return requests.getOrDefault(user, UserRequest.NONE);
    }

    public Map<String, UserPosition> positions() {
        return Collections.unmodifiableMap(positions);
    }

    /** Reported synthetic amount of a position. */
    public BigDecimal assetAmount(String user) {
        UserPosition position = positions.get(user);
        return position == null ? Decimals.ZERO : valuation.toAsset(position.getAssetShares());
    }

    public HealthStatus health(String user) {
        UserPosition position = requirePosition(user);
        PolicyParameters params = policy.parameters();
        BigDecimal exposure = valuation.value(position.getAssetShares());
        BigDecimal effectiveCollateral = Decimals.nonNegative(position.getCollateralAmount().subtract(interestDebt(position)));
        return policy.health(effectiveCollateral, exposure, params.userHealthyRatio(), params.userLiquidationThreshold());
    }

    /** Interest owed by a position up to the latest index snapshot, in reserve units. */
    public BigDecimal interestDebt(String user) {
        return interestDebt(requirePosition(user));
    }

    // ---------------------------------------------------------------- orchestrator hooks

    /**
     * Moves the pool aggregates from pending to settled once a cycle closes.
     *
     * @param redemptionValue asset value of all settled redemptions and liquidations
     * @param interest        interest those requests owe
     */
    void settleCycle(long cycle, BigDecimal price, BigDecimal redemptionValue, BigDecimal interest) {
        BigDecimal mintedShares = valuation.toShares(Decimals.divDown(book.getPendingDeposits(), price));
        book.adjustTotalAssetShares(mintedShares.subtract(book.getPendingRedemptionShares()));
        book.adjustClaimLiability(redemptionValue.subtract(interest));
        liquidationInitiators.forEach((target, liquidator) -> {
            UserRequest request = requests.get(liquidator);
            if (request != null) {
                settledLiquidationShares.merge(target, request.amount(), BigDecimal::add);
            }
        });
        liquidationInitiators.clear();
        log.info("[UserLedger] {} cycle {} settled: mintedShares={}, redeemedShares={}, totalShares={}",
                book.getSymbol(), cycle, mintedShares.toPlainString(),
                book.getPendingRedemptionShares().toPlainString(), book.getTotalAssetShares().toPlainString());
    }

    // ---------------------------------------------------------------- helpers

    /**
     * Asset-weighted average of two index entries, rounded down.
     */
    static BigDecimal weightedIndex(BigDecimal existingShares, BigDecimal existingIndex,
                                    BigDecimal addedShares, BigDecimal addedIndex) {
        if (existingShares.signum() == 0) {
            return addedIndex;
        }
        BigDecimal total = existingShares.add(addedShares);
        if (total.signum() == 0) {
            return existingIndex;
        }
        BigDecimal weighted = existingShares.multiply(existingIndex).add(addedShares.multiply(addedIndex));
        return Decimals.divDown(weighted, total);
    }

    private BigDecimal interestDebt(UserPosition position) {
        if (position.getAssetShares().signum() == 0) {
            return Decimals.ZERO;
        }
        return interestCharge(valuation.toAsset(position.getAssetShares()), position.getInterestIndex(),
                book.getCurrentIndex(), valuation.price());
    }

    private static BigDecimal interestCharge(BigDecimal assetAmount, BigDecimal fromIndex,
                                             BigDecimal toIndex, BigDecimal price) {
        BigDecimal delta = toIndex.subtract(fromIndex);
        if (delta.signum() <= 0) {
            return Decimals.ZERO;
        }
        return Decimals.up(assetAmount.multiply(delta).multiply(price));
    }

    private BigDecimal totalUserCollateral() {
        return positions.values().stream()
                .map(UserPosition::getCollateralAmount)
                .reduce(Decimals.ZERO, BigDecimal::add);
    }

    /** Tokens a request holds in custody, rescaled if a split was applied since. */
    private BigDecimal escrowedTokens(UserRequest request) {
        BigDecimal multiplier = token.splitMultiplier();
        if (request.escrowMultiplier().compareTo(multiplier) == 0) {
            return request.escrow();
        }
        return Decimals.mulDivDown(request.escrow(), multiplier, request.escrowMultiplier());
    }

    private static BigDecimal proportion(BigDecimal value, BigDecimal part, BigDecimal whole) {
        if (whole.signum() == 0) {
            return Decimals.ZERO;
        }
        return Decimals.mulDivDown(value, part, whole);
    }

    private BigDecimal liquidationsAgainst(String target) {
        BigDecimal settled = settledLiquidationShares.getOrDefault(target, Decimals.ZERO);
        String liquidator = liquidationInitiators.get(target);
        if (liquidator == null) {
            return settled;
        }
        return settled.add(requests.get(liquidator).amount());
    }

    private BigDecimal pendingRedemptionOf(String user) {
        UserRequest request = requests.get(user);
        return request != null && request.type() == UserRequestType.REDEEM ? request.amount() : Decimals.ZERO;
    }

    private void requireSettled(UserRequest request) {
        if (request.cycle() >= book.getCurrentCycle()) {
            throw ProtocolException.of(ErrorCode.REQUEST_NOT_SETTLED, "request cycle=%d, current=%d",
                    request.cycle(), book.getCurrentCycle());
        }
    }

    private UserPosition emptyPosition() {
        return UserPosition.builder()
                .assetShares(Decimals.ZERO)
                .reserveAmount(Decimals.ZERO)
                .collateralAmount(Decimals.ZERO)
                .interestIndex(Decimals.ONE)
                .build();
    }

    private UserPosition requirePosition(String user) {
        UserPosition position = positions.get(user);
        if (position == null) {
            throw ProtocolException.of(ErrorCode.POSITION_NOT_FOUND, "user=%s", user);
        }
        return position;
    }

    private UserRequest requireRequest(String user) {
        UserRequest request = requests.get(user);
        if (request == null) {
            throw ProtocolException.of(ErrorCode.NO_PENDING_REQUEST, "user=%s", user);
        }
        return request;
    }

    private void requireNoRequest(String user) {
        if (requests.containsKey(user)) {
            throw ProtocolException.of(ErrorCode.REQUEST_PENDING, "user=%s has %s", user, requests.get(user).type());
        }
    }

    private void requireTokenBalance(String account, BigDecimal amount) {
        if (token.balanceOf(account).compareTo(amount) < 0) {
            throw ProtocolException.of(ErrorCode.INSUFFICIENT_BALANCE, "%s holds %s %s, needs %s",
                    account, token.balanceOf(account).toPlainString(), token.symbol(), amount.toPlainString());
        }
    }

    private void requireReserveBalance(String account, BigDecimal amount) {
        if (reserve.balanceOf(account).compareTo(amount) < 0) {
            throw ProtocolException.of(ErrorCode.INSUFFICIENT_BALANCE, "%s holds %s %s, needs %s",
                    account, reserve.balanceOf(account).toPlainString(), reserve.symbol(), amount.toPlainString());
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
