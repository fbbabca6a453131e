package com.updown.strategy;

/**
 * Per-component scores of one evaluation. {@code rawTotal} is the plain sum of the components;
 * {@code total} is what gets compared with the threshold: floored at zero, and forced to zero
 * when the kill switch fired.
 */
public record ScoreBreakdown(
		Direction direction,
		int bandScore,
		int barrierScore,
		int depthScore,
		int valueScore,
		int rawTotal,
		int total,
		boolean killSwitch,
		Double bandPosition,
		Double maxMove,
		double distance,
		Double depthRatio,
		Double contractPrice,
		boolean insufficientData) {

	public boolean meetsThreshold(int threshold) {
		return total >= threshold;
	}
}
