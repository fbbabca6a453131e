package com.updown.strategy;

public record DepthReading(
		double bidVolume,
		double askVolume,
		double ratio,
		Direction direction,
		double scanDepth) {
}
