package com.updown.strategy.indicators;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Arithmetic mean of the last {@code period} true ranges. No smoothing state is carried between
 * calls.
 */
public final class AverageTrueRange {

	private AverageTrueRange() {
	}

	public static OptionalDouble compute(List<Double> highs, List<Double> lows, List<Double> closes, int period) {
		if (highs == null || lows == null || closes == null || period <= 0) {
			return OptionalDouble.empty();
		}
		int size = Math.min(closes.size(), Math.min(highs.size(), lows.size()));
		if (size < period + 1) {
			return OptionalDouble.empty();
		}
		double sum = 0.0;
		for (int i = size - period; i < size; i++) {
			sum += trueRange(highs.get(i), lows.get(i), closes.get(i - 1));
		}
		double atr = sum / period;
		return Double.isFinite(atr) ? OptionalDouble.of(atr) : OptionalDouble.empty();
	}

	static double trueRange(double high, double low, double previousClose) {
		return Math.max(high - low,
				Math.max(Math.abs(high - previousClose), Math.abs(low - previousClose)));
	}
}
