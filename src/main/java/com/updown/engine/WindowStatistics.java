package com.updown.engine;

import com.updown.strategy.ScoreBreakdown;

/**
 * Running sums over every tick scored inside the trading sub-window. Immutable; each tick
 * produces a new value, so a snapshot taken mid-window can be stored and resumed.
 */
public record WindowStatistics(
		long bandSum,
		long barrierSum,
		long depthSum,
		long valueSum,
		long totalSum,
		int evaluations,
		int signals,
		int blocked,
		int maxScore) {

	public static final WindowStatistics EMPTY = new WindowStatistics(0, 0, 0, 0, 0, 0, 0, 0, 0);

	public WindowStatistics plus(ScoreBreakdown breakdown, TickOutcome outcome) {
		return new WindowStatistics(
				bandSum + breakdown.bandScore(),
				barrierSum + breakdown.barrierScore(),
				depthSum + breakdown.depthScore(),
				valueSum + breakdown.valueScore(),
				totalSum + breakdown.total(),
				evaluations + 1,
				signals + (outcome == TickOutcome.SIGNAL || outcome == TickOutcome.ENTRY_FAILED ? 1 : 0),
				blocked + (outcome == TickOutcome.BLOCKED ? 1 : 0),
				evaluations == 0 ? breakdown.total() : Math.max(maxScore, breakdown.total()));
	}

	public double averageBand() {
		return average(bandSum);
	}

	public double averageBarrier() {
		return average(barrierSum);
	}

	public double averageDepth() {
		return average(depthSum);
	}

	public double averageValue() {
		return average(valueSum);
	}

	public double averageTotal() {
		return average(totalSum);
	}

	private double average(long sum) {
		return evaluations == 0 ? 0.0 : (double) sum / evaluations;
	}
}
