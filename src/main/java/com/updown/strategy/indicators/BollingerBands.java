package com.updown.strategy.indicators;

import java.util.List;
import java.util.Optional;

/**
 * Simple-moving-average Bollinger channel over the last {@code period} closes, using the
 * population standard deviation.
 */
public final class BollingerBands {

	private BollingerBands() {
	}

	public static Optional<Bands> compute(List<Double> closes, int period, double stdDevMultiplier) {
		if (closes == null || period <= 0 || closes.size() < period) {
			return Optional.empty();
		}
		int start = closes.size() - period;
		double sum = 0.0;
		for (int i = start; i < closes.size(); i++) {
			sum += closes.get(i);
		}
		double middle = sum / period;
		double squared = 0.0;
		for (int i = start; i < closes.size(); i++) {
			double diff = closes.get(i) - middle;
			squared += diff * diff;
		}
		double deviation = Math.sqrt(squared / period);
		if (!Double.isFinite(middle) || !Double.isFinite(deviation)) {
			return Optional.empty();
		}
		return Optional.of(new Bands(middle + stdDevMultiplier * deviation, middle,
				middle - stdDevMultiplier * deviation));
	}

	public record Bands(double upper, double middle, double lower) {

		public double width() {
			return upper - lower;
		}
	}
}
