package com.updown.engine;

import java.util.List;

import com.updown.position.PositionState;
import com.updown.strategy.Direction;

public record TickLog(
		String windowId,
		Double minutesLeft,
		Double referencePrice,
		String referenceSource,
		Double strikePrice,
		Direction direction,
		Double upper,
		Double middle,
		Double lower,
		Double atr,
		Double rsi,
		Double bandPosition,
		Double maxMove,
		Double distance,
		Double depthRatio,
		Double contractPrice,
		boolean contractPriceStale,
		Integer bandScore,
		Integer barrierScore,
		Integer depthScore,
		Integer valueScore,
		Integer rawTotal,
		Integer total,
		Integer threshold,
		boolean killSwitch,
		boolean insufficientData,
		List<String> failedConstraints,
		PositionState state,
		TickOutcome outcome) {
}
