package com.synthetic.cycleengine.api.dto;

public record ResolveDeviationRequest(String admin, boolean split, long ratioNum, long ratioDen) {
}
