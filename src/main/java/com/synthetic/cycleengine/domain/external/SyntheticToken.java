package com.synthetic.cycleengine.domain.external;

import java.math.BigDecimal;

/**
 * Synthetic asset token. Balances reflect the split multiplier.
 */
public interface SyntheticToken {

    String symbol();

    void mint(String account, BigDecimal amount);

    void burn(String account, BigDecimal amount);

    void transfer(String from, String to, BigDecimal amount);

    BigDecimal balanceOf(String account);

    BigDecimal totalSupply();

    /** Scales every balance and the total supply by {@code ratioNum / ratioDen}. */
    void applySplit(long ratioNum, long ratioDen);

    BigDecimal splitMultiplier();
}
