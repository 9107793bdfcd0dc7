package com.synthetic.cycleengine.infra.oracle;

import com.synthetic.cycleengine.domain.exception.ErrorCode;
import com.synthetic.cycleengine.domain.exception.ProtocolException;
import com.synthetic.cycleengine.domain.external.AssetOracle;
import com.synthetic.cycleengine.domain.model.OracleQuote;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * Oracle fed by an external price pusher (daily OHLC plus a market-open flag).
 * <p>
 * A split is assumed when the new close sits within {@value #SPLIT_TOLERANCE_PCT}%
 * of the previous close divided by an integer ratio between 2 and
 * {@value #MAX_SPLIT_RATIO}, or multiplied by one for a reverse split. The
 * detection stays armed while later closes keep that ratio to the pre-split
 * price.
 */
@Slf4j
public class FeedAssetOracle implements AssetOracle {

    static final int MAX_SPLIT_RATIO = 50;
    static final int SPLIT_TOLERANCE_PCT = 2;

    private static final BigDecimal TOLERANCE = BigDecimal.valueOf(SPLIT_TOLERANCE_PCT).movePointLeft(2);
    private static final MathContext MC = MathContext.DECIMAL64;

    private final String symbol;

    private volatile OracleQuote latest;
    private volatile boolean marketOpen;
    private volatile Instant lastUpdate = Instant.EPOCH;
    private volatile boolean splitDetected;
    private volatile BigDecimal preSplitPrice;
    private volatile long splitNum;
    private volatile long splitDen;

    public FeedAssetOracle(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Records a new quote. The quote's own timestamp is kept on the quote; the
     * staleness checks use {@code receivedAt}.
     */
    public synchronized void update(OracleQuote quote, boolean marketOpen, Instant receivedAt) {
        if (quote == null || quote.close() == null || quote.close().signum() <= 0) {
            throw ProtocolException.of(ErrorCode.PRICE_NOT_IN_RANGE, "%s close must be positive", symbol);
        }
        OracleQuote previous = latest;
        if (splitDetected && !matchesRatio(preSplitPrice, quote.close(), splitNum, splitDen)) {
            log.info("[Oracle] {} split {}:{} no longer matches close {}, clearing",
                    symbol, splitNum, splitDen, quote.close().toPlainString());
            clearSplit();
        }
        if (!splitDetected && previous != null) {
            detectSplit(previous.close(), quote.close());
        }

        this.latest = quote;
        this.marketOpen = marketOpen;
        this.lastUpdate = receivedAt;
        log.debug("[Oracle] {} close={} open={} marketOpen={}",
                symbol, quote.close().toPlainString(), quote.open(), marketOpen);
    }

    public synchronized void setMarketOpen(boolean marketOpen) {
        this.marketOpen = marketOpen;
    }

    @Override
    public String symbol() {
        return symbol;
    }

    @Override
    public BigDecimal currentPrice() {
        OracleQuote quote = latest;
        if (quote == null) {
            throw ProtocolException.of(ErrorCode.ORACLE_NOT_UPDATED, "%s has no price yet", symbol);
        }
        return quote.close();
    }

    @Override
    public OracleQuote latestQuote() {
        return latest;
    }

    @Override
    public boolean isMarketOpen() {
        return marketOpen;
    }

    @Override
    public Instant lastUpdateTimestamp() {
        return lastUpdate;
    }

    @Override
    public boolean splitDetected() {
        return splitDetected;
    }

    @Override
    public BigDecimal preSplitPrice() {
        return preSplitPrice;
    }

    @Override
    public boolean verifySplit(long ratioNum, long ratioDen) {
        if (!splitDetected || ratioNum <= 0 || ratioDen <= 0) {
            return false;
        }
        return Math.multiplyExact(ratioNum, splitDen) == Math.multiplyExact(ratioDen, splitNum);
    }

    private void detectSplit(BigDecimal previousClose, BigDecimal close) {
        if (previousClose == null || previousClose.signum() <= 0) {
            return;
        }
        BigDecimal forward = previousClose.divide(close, MC);
        BigDecimal reverse = close.divide(previousClose, MC);
        long ratio;
        boolean isReverse;
        if (forward.compareTo(BigDecimal.ONE) > 0) {
            ratio = forward.setScale(0, RoundingMode.HALF_UP).longValue();
            isReverse = false;
        } else {
            ratio = reverse.setScale(0, RoundingMode.HALF_UP).longValue();
            isReverse = true;
        }
        if (ratio < 2 || ratio > MAX_SPLIT_RATIO) {
            return;
        }
        long num = isReverse ? 1L : ratio;
        long den = isReverse ? ratio : 1L;
        if (matchesRatio(previousClose, close, num, den)) {
            splitDetected = true;
            preSplitPrice = previousClose;
            splitNum = num;
            splitDen = den;
            log.warn("[Oracle] {} split {}:{} detected: {} -> {}",
                    symbol, num, den, previousClose.toPlainString(), close.toPlainString());
        }
    }

    /** |close - base * den / num| within the tolerance of the expected price. */
    private static boolean matchesRatio(BigDecimal base, BigDecimal close, long num, long den) {
        BigDecimal expected = base.multiply(BigDecimal.valueOf(den)).divide(BigDecimal.valueOf(num), MC);
        BigDecimal drift = close.subtract(expected).abs();
        return drift.compareTo(expected.multiply(TOLERANCE)) <= 0;
    }

    private void clearSplit() {
        splitDetected = false;
        preSplitPrice = null;
        splitNum = 0L;
        splitDen = 0L;
    }
}
