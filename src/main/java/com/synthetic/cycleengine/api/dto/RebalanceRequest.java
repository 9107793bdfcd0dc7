package com.synthetic.cycleengine.api.dto;

import java.math.BigDecimal;

/**
 * LP settlement. {@code amount} and {@code contribution} are optional; when
 * present they must match the computed obligation.
 */
public record RebalanceRequest(String lp, BigDecimal price, BigDecimal amount, Boolean contribution) {
}
