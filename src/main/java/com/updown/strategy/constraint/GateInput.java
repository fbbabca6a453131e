package com.updown.strategy.constraint;

import com.updown.strategy.Direction;

/**
 * Observables the hard constraints look at. Prices and ratios are null when they could not be read.
 */
public record GateInput(
		Direction direction,
		Double contractPrice,
		Double depthRatio) {
}
