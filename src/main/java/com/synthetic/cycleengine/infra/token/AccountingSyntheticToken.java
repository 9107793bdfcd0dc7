package com.synthetic.cycleengine.infra.token;

import com.synthetic.cycleengine.domain.exception.ErrorCode;
import com.synthetic.cycleengine.domain.exception.ProtocolException;
import com.synthetic.cycleengine.domain.external.SyntheticToken;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process synthetic token. Balances are kept in the units chosen by the
 * {@link TokenAccounting} and reported through the split multiplier.
 */
@Slf4j
public class AccountingSyntheticToken implements SyntheticToken {

    private static final int SCALE = TokenAccounting.SCALE;
    private static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);

    private final String symbol;
    private final TokenAccounting accounting;
    private final Map<String, BigDecimal> stored = new ConcurrentHashMap<>();

    private volatile BigDecimal storedSupply = ZERO;
    private volatile BigDecimal multiplier = BigDecimal.ONE.setScale(SCALE);

    public AccountingSyntheticToken(String symbol, TokenAccounting accounting) {
        this.symbol = symbol;
        this.accounting = accounting;
    }

    @Override
    public String symbol() {
        return symbol;
    }

    @Override
    public synchronized void mint(String account, BigDecimal amount) {
        requireAccount(account);
        requirePositive(amount);
        BigDecimal units = accounting.toStored(amount, multiplier, RoundingMode.DOWN);
        stored.merge(account, units, BigDecimal::add);
        storedSupply = storedSupply.add(units);
    }

    @Override
    public synchronized void burn(String account, BigDecimal amount) {
        requireAccount(account);
        requirePositive(amount);
        BigDecimal units = debitUnits(account, amount);
        stored.put(account, held(account).subtract(units));
        storedSupply = storedSupply.subtract(units);
    }

    @Override
    public synchronized void transfer(String from, String to, BigDecimal amount) {
        requireAccount(from);
        requireAccount(to);
        requirePositive(amount);
        BigDecimal units = debitUnits(from, amount);
        stored.put(from, held(from).subtract(units));
        stored.merge(to, units, BigDecimal::add);
    }

    @Override
    public BigDecimal balanceOf(String account) {
        return accounting.toReported(held(account), multiplier);
    }

    @Override
    public BigDecimal totalSupply() {
        return accounting.toReported(storedSupply, multiplier);
    }

    @Override
    public synchronized void applySplit(long ratioNum, long ratioDen) {
        if (ratioNum <= 0 || ratioDen <= 0) {
            throw ProtocolException.of(ErrorCode.INVALID_SPLIT, "ratio %d:%d", ratioNum, ratioDen);
        }
        BigDecimal num = BigDecimal.valueOf(ratioNum);
        BigDecimal den = BigDecimal.valueOf(ratioDen);
        multiplier = multiplier.multiply(num).divide(den, SCALE, RoundingMode.DOWN);

        if (accounting.rebasesOnSplit()) {
            BigDecimal supply = ZERO;
            for (Map.Entry<String, BigDecimal> e : stored.entrySet()) {
                BigDecimal rebased = e.getValue().multiply(num).divide(den, SCALE, RoundingMode.DOWN);
                e.setValue(rebased);
                supply = supply.add(rebased);
            }
            storedSupply = supply;
        }
        log.info("[Token] {} split {}:{} applied, multiplier={}, supply={}",
                symbol, ratioNum, ratioDen, multiplier.toPlainString(), totalSupply().toPlainString());
    }

    @Override
    public BigDecimal splitMultiplier() {
        return multiplier;
    }

    public TokenAccounting accounting() {
        return accounting;
    }

    /** Stored units for a debit of {@code amount}, capped at what the account holds. */
    private BigDecimal debitUnits(String account, BigDecimal amount) {
        BigDecimal balance = balanceOf(account);
        if (balance.compareTo(amount) < 0) {
            throw ProtocolException.of(ErrorCode.INSUFFICIENT_BALANCE, "%s holds %s %s, needs %s",
                    account, balance.toPlainString(), symbol, amount.toPlainString());
        }
        return accounting.toStored(amount, multiplier, RoundingMode.UP).min(held(account));
    }

    private BigDecimal held(String account) {
        return account == null ? ZERO : stored.getOrDefault(account, ZERO);
    }

    private static void requireAccount(String account) {
        if (account == null || account.isBlank()) {
            throw new ProtocolException(ErrorCode.ZERO_ADDRESS);
        }
    }

    private static void requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new ProtocolException(ErrorCode.ZERO_AMOUNT);
        }
    }
}
