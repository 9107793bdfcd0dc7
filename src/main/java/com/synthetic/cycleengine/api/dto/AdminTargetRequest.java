package com.synthetic.cycleengine.api.dto;

/**
 * Admin action against one account: force settlement, LP removal, fee
 * collection or role changes.
 */
public record AdminTargetRequest(String admin, String account) {
}
