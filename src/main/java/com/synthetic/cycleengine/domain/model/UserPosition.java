package com.synthetic.cycleengine.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;

/**
 * Settled user position. {@code assetShares} is kept in pre-split units; the
 * reported asset amount is {@code assetShares * splitMultiplier}.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserPosition {

    private BigDecimal assetShares;
    private BigDecimal reserveAmount;
    private BigDecimal collateralAmount;
    private BigDecimal interestIndex;

    public boolean isEmpty() {
        return assetShares.signum() == 0 && collateralAmount.signum() == 0;
    }
}
