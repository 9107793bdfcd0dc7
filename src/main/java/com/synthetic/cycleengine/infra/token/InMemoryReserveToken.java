package com.synthetic.cycleengine.infra.token;

import com.synthetic.cycleengine.domain.exception.ErrorCode;
import com.synthetic.cycleengine.domain.exception.ProtocolException;
import com.synthetic.cycleengine.domain.external.ReserveToken;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reserve token ledger with exact-amount transfers, shared by every pool.
 */
@Slf4j
public class InMemoryReserveToken implements ReserveToken {

    private static final BigDecimal ZERO = BigDecimal.ZERO.setScale(18);

    private final String symbol;
    private final Map<String, BigDecimal> balances = new ConcurrentHashMap<>();

    public InMemoryReserveToken(String symbol) {
        this.symbol = symbol;
    }

    @Override
    public String symbol() {
        return symbol;
    }

    @Override
    public BigDecimal balanceOf(String account) {
        return account == null ? ZERO : balances.getOrDefault(account, ZERO);
    }

    @Override
    public synchronized void transfer(String from, String to, BigDecimal amount) {
        requireAccount(from);
        requireAccount(to);
        if (amount == null || amount.signum() < 0) {
            throw new ProtocolException(ErrorCode.ZERO_AMOUNT);
        }
        if (amount.signum() == 0) {
            return;
        }
        BigDecimal balance = balanceOf(from);
        if (balance.compareTo(amount) < 0) {
            throw ProtocolException.of(ErrorCode.INSUFFICIENT_BALANCE, "%s holds %s %s, needs %s",
                    from, balance.toPlainString(), symbol, amount.toPlainString());
        }
        balances.put(from, balance.subtract(amount));
        balances.merge(to, amount, BigDecimal::add);
    }

    @Override
    public synchronized void mint(String account, BigDecimal amount) {
        requireAccount(account);
        if (amount == null || amount.signum() <= 0) {
            throw new ProtocolException(ErrorCode.ZERO_AMOUNT);
        }
        balances.merge(account, amount, BigDecimal::add);
        log.info("[Reserve] minted {} {} to {}", amount.toPlainString(), symbol, account);
    }

    private static void requireAccount(String account) {
        if (account == null || account.isBlank()) {
            throw new ProtocolException(ErrorCode.ZERO_ADDRESS);
        }
    }
}
