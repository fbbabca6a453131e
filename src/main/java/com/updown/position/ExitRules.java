package com.updown.position;

/**
 * Take-profit compares the contract bid with an absolute price; stop-loss is a fractional
 * drawdown from the entry price.
 */
public record ExitRules(double takeProfitPrice, double stopLossPct) {

	public static ExitRules defaults() {
		return new ExitRules(0.98, 0.30);
	}
}
