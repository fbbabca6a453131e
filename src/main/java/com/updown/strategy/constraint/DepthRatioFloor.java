package com.updown.strategy.constraint;

public record DepthRatioFloor(double minRatio) implements HardConstraint {

	@Override
	public String name() {
		return "DEPTH_RATIO_FLOOR";
	}

	@Override
	public boolean test(GateInput input) {
		Double ratio = input.depthRatio();
		return ratio != null && ratio >= minRatio;
	}
}
