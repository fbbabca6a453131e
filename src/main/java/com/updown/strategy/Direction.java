package com.updown.strategy;

/**
 * Side of the strike a position is betting the reference price finishes on.
 */
public enum Direction {
	UP,
	DOWN;

	public static Direction favored(double referencePrice, double strikePrice) {
		return referencePrice > strikePrice ? UP : DOWN;
	}

	public boolean winsAt(double finalPrice, double strikePrice) {
		return this == UP ? finalPrice > strikePrice : finalPrice < strikePrice;
	}

	/**
	 * True once the reference has crossed the strike against this direction.
	 */
	public boolean breachedBy(double referencePrice, double strikePrice) {
		return this == UP ? referencePrice < strikePrice : referencePrice > strikePrice;
	}
}
