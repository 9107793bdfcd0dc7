package com.synthetic.cycleengine.domain.exception;

/**
 * Named rejection reasons. Every code belongs to exactly one {@link ErrorKind}.
 */
public enum ErrorCode {

    INVALID_CYCLE_STATE(ErrorKind.STATE, "operation not allowed in the current cycle state"),
    CYCLE_IN_PROGRESS(ErrorKind.STATE, "cycle length has not elapsed"),
    REBALANCE_IN_PROGRESS(ErrorKind.STATE, "rebalance length has not elapsed"),
    MARKET_OPEN(ErrorKind.STATE, "market is still open"),
    MARKET_CLOSED(ErrorKind.STATE, "market is closed"),
    POOL_HALTED(ErrorKind.STATE, "pool is halted"),
    POOL_NOT_HALTED(ErrorKind.STATE, "pool is not halted"),
    ALREADY_REBALANCED(ErrorKind.STATE, "liquidity provider already settled this cycle"),
    HALT_THRESHOLD_NOT_REACHED(ErrorKind.STATE, "halt threshold has not elapsed"),
    REQUEST_PENDING(ErrorKind.STATE, "a request is already pending"),
    REQUEST_NOT_SETTLED(ErrorKind.STATE, "request cycle has not been settled yet"),
    CANCEL_WINDOW_CLOSED(ErrorKind.STATE, "request can no longer be cancelled"),
    LIQUIDITY_COMMITTED(ErrorKind.STATE, "liquidity is still committed"),
    DEVIATION_ALREADY_RESOLVED(ErrorKind.STATE, "price deviation already resolved for this cycle"),

    ZERO_AMOUNT(ErrorKind.VALIDATION, "amount must be positive"),
    ZERO_ADDRESS(ErrorKind.VALIDATION, "account is required"),
    EXCESSIVE_AMOUNT(ErrorKind.VALIDATION, "amount exceeds the allowed cap"),
    INVALID_LIQUIDATION(ErrorKind.VALIDATION, "liquidation amount must exceed the pending one"),
    SELF_LIQUIDATION(ErrorKind.VALIDATION, "cannot liquidate own position"),
    PRICE_NOT_IN_RANGE(ErrorKind.VALIDATION, "price outside tolerance of the settlement price"),
    INVALID_SPLIT(ErrorKind.VALIDATION, "split not confirmed by oracle at that ratio"),
    REBALANCE_MISMATCH(ErrorKind.VALIDATION, "declared amount does not match the settlement obligation"),

    NOT_AUTHORIZED(ErrorKind.AUTHORIZATION, "caller lacks the required role"),

    INSUFFICIENT_BALANCE(ErrorKind.CONSISTENCY, "insufficient balance"),
    INSUFFICIENT_COLLATERAL(ErrorKind.CONSISTENCY, "insufficient collateral"),
    INSUFFICIENT_LIQUIDITY(ErrorKind.CONSISTENCY, "insufficient liquidity"),
    INSUFFICIENT_POSITION(ErrorKind.CONSISTENCY, "position smaller than requested amount"),
    NOT_LIQUIDATABLE(ErrorKind.CONSISTENCY, "position is not liquidatable"),

    ORACLE_NOT_UPDATED(ErrorKind.STALENESS, "oracle data is stale"),
    PRICE_DEVIATION_HIGH(ErrorKind.STALENESS, "price deviation must be resolved first"),

    NO_PENDING_REQUEST(ErrorKind.NOT_FOUND, "no pending request"),
    NOTHING_TO_CLAIM(ErrorKind.NOT_FOUND, "nothing to claim"),
    POSITION_NOT_FOUND(ErrorKind.NOT_FOUND, "position not found"),
    LP_NOT_FOUND(ErrorKind.NOT_FOUND, "liquidity provider not found"),
    NOT_ACTIVE_LP(ErrorKind.NOT_FOUND, "liquidity provider is not active in this cycle"),
    POOL_NOT_FOUND(ErrorKind.NOT_FOUND, "pool not found");

    private final ErrorKind kind;
    private final String defaultMessage;

    ErrorCode(ErrorKind kind, String defaultMessage) {
        this.kind = kind;
        this.defaultMessage = defaultMessage;
    }

    public ErrorKind kind() {
        return kind;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
