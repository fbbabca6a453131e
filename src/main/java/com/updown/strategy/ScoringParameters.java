package com.updown.strategy;

public record ScoringParameters(
		double atrMultiplier,
		double barrierSaturation,
		double depthRatioFloor,
		double depthRatioCap,
		double depthScanFraction,
		double valueFloorPrice,
		double valueFullPrice,
		double valueZeroPrice) {

	public static ScoringParameters defaults() {
		return new ScoringParameters(1.5, 1.5, 0.3, 3.0, 0.001, 0.30, 0.50, 0.85);
	}
}
