package com.updown.strategy.indicators;

import java.util.List;
import java.util.OptionalDouble;

/**
 * RSI from simple means of the last {@code period} gains and losses (no Wilder smoothing).
 */
public final class RelativeStrength {

	private RelativeStrength() {
	}

	public static OptionalDouble compute(List<Double> closes, int period) {
		if (closes == null || period <= 0 || closes.size() < period + 1) {
			return OptionalDouble.empty();
		}
		double gains = 0.0;
		double losses = 0.0;
		for (int i = closes.size() - period; i < closes.size(); i++) {
			double delta = closes.get(i) - closes.get(i - 1);
			if (delta > 0) {
				gains += delta;
			} else if (delta < 0) {
				losses -= delta;
			}
		}
		double avgGain = gains / period;
		double avgLoss = losses / period;
		if (avgLoss == 0.0) {
			return OptionalDouble.of(avgGain > 0 ? 100.0 : 50.0);
		}
		double rs = avgGain / avgLoss;
		return OptionalDouble.of(100.0 - (100.0 / (1.0 + rs)));
	}
}
