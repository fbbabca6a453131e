package com.updown.strategy.indicators;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import java.util.List;
import java.util.OptionalDouble;

import org.junit.jupiter.api.Test;

class AverageTrueRangeTest {

	@Test
	void averagesTrueRangesAgainstPreviousClose() {
		List<Double> highs = List.of(10.0, 11.0, 12.0);
		List<Double> lows = List.of(8.0, 9.0, 9.5);
		List<Double> closes = List.of(9.0, 10.0, 11.0);

		OptionalDouble atr = AverageTrueRange.compute(highs, lows, closes, 2);

		assertEquals(2.25, atr.getAsDouble(), 1e-12);
	}

	@Test
	void gapAgainstPreviousCloseWidensTheRange() {
		assertEquals(5.0, AverageTrueRange.trueRange(15.0, 14.0, 10.0), 1e-12);
		assertEquals(5.0, AverageTrueRange.trueRange(7.0, 6.0, 11.0), 1e-12);
		assertEquals(4.0, AverageTrueRange.trueRange(14.0, 13.0, 10.0), 1e-12);
	}

	@Test
	void needsOneSampleMoreThanThePeriod() {
		List<Double> values = List.of(1.0, 2.0);

		assertFalse(AverageTrueRange.compute(values, values, values, 2).isPresent());
		assertFalse(AverageTrueRange.compute(List.of(), List.of(), List.of(), 14).isPresent());
	}

	@Test
	void isDeterministic() {
		List<Double> highs = List.of(10.0, 11.0, 12.0, 12.5, 13.1);
		List<Double> lows = List.of(8.0, 9.0, 9.5, 11.0, 12.0);
		List<Double> closes = List.of(9.0, 10.0, 11.0, 12.0, 12.7);

		assertEquals(AverageTrueRange.compute(highs, lows, closes, 3), AverageTrueRange.compute(highs, lows, closes, 3));
	}
}
