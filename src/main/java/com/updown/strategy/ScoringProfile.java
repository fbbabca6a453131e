package com.updown.strategy;

/**
 * Component weights, entry threshold and optional kill-switch ceiling for one scoring scheme.
 * A null {@code killSwitchPrice} disables the kill switch.
 */
public record ScoringProfile(
		int bandWeight,
		int barrierWeight,
		int depthWeight,
		int valueWeight,
		int threshold,
		Double killSwitchPrice) {

	public ScoringProfile {
		if (bandWeight < 0 || barrierWeight < 0 || depthWeight < 0 || valueWeight < 0) {
			throw new IllegalArgumentException("weights must not be negative");
		}
	}

	public int maxScore() {
		return bandWeight + barrierWeight + depthWeight + valueWeight;
	}

	public ScoringProfile withThreshold(int newThreshold) {
		return new ScoringProfile(bandWeight, barrierWeight, depthWeight, valueWeight, newThreshold, killSwitchPrice);
	}

	public ScoringProfile withKillSwitchPrice(Double newKillSwitchPrice) {
		return new ScoringProfile(bandWeight, barrierWeight, depthWeight, valueWeight, threshold, newKillSwitchPrice);
	}
}
