package com.updown.engine;

/**
 * Minutes-before-expiry interval in which entries are evaluated, bounds inclusive.
 */
public record TradeWindow(double minMinutes, double maxMinutes) {

	public TradeWindow {
		if (minMinutes < 0 || maxMinutes < minMinutes) {
			throw new IllegalArgumentException("invalid trade window " + minMinutes + ".." + maxMinutes);
		}
	}

	public boolean contains(double minutesLeft) {
		return minutesLeft >= minMinutes && minutesLeft <= maxMinutes;
	}

	public boolean isPast(double minutesLeft) {
		return minutesLeft < minMinutes;
	}
}
