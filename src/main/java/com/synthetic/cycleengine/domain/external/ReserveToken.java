package com.synthetic.cycleengine.domain.external;

import java.math.BigDecimal;

/**
 * Collateral/reserve token with exact-amount transfers.
 */
public interface ReserveToken {

    String symbol();

    BigDecimal balanceOf(String account);

    void transfer(String from, String to, BigDecimal amount);

    void mint(String account, BigDecimal amount);
}
