package com.updown.strategy;

public final class ScoreMath {

	private ScoreMath() {
	}

	public static double clamp(double value, double min, double max) {
		return Math.max(min, Math.min(max, value));
	}

	public static double unitClamp(double value) {
		return clamp(value, 0.0, 1.0);
	}

	/**
	 * Linear position of {@code value} between {@code from} (0) and {@code to} (1), clamped.
	 * Works for descending ramps too ({@code from > to}).
	 */
	public static double ramp(double value, double from, double to) {
		if (from == to) {
			return value >= to ? 1.0 : 0.0;
		}
		return unitClamp((value - from) / (to - from));
	}

	/**
	 * Integer share of {@code weight}, rounded half-up.
	 */
	public static int weighted(int weight, double ratio) {
		if (weight <= 0 || !Double.isFinite(ratio)) {
			return 0;
		}
		return (int) Math.round(weight * unitClamp(ratio));
	}

	public static boolean isFinitePositive(Double value) {
		return value != null && Double.isFinite(value) && value > 0;
	}
}
