package com.updown.strategy;

/**
 * Everything one score evaluation reads. {@code contractPrice} is the ask of the favored
 * contract and {@code depthRatio} the reference book ratio; both may be null when unavailable.
 */
public record ScoreInput(
		double referencePrice,
		double strikePrice,
		IndicatorSet indicators,
		double minutesRemaining,
		Double contractPrice,
		Double depthRatio) {

	public Direction direction() {
		return Direction.favored(referencePrice, strikePrice);
	}
}
