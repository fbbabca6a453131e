package com.updown.position;

import java.math.BigDecimal;
import java.util.Optional;

public final class ExitEvaluator {

	private ExitEvaluator() {
	}

	/**
	 * First satisfied trigger in {@link ExitReason} order. A missing bid only disables the
	 * price-based triggers; the strike barrier needs nothing but the reference price.
	 * Stop-loss needs the bid strictly below {@code entry * (1 - stopLossPct)}, compared in decimal.
	 */
	public static Optional<ExitReason> evaluate(Position position, ExitRules rules, Double bestBid,
			double referencePrice, double strikePrice) {
		if (position == null || position.closed()) {
			return Optional.empty();
		}
		if (bestBid != null) {
			if (bestBid >= rules.takeProfitPrice()) {
				return Optional.of(ExitReason.TAKE_PROFIT);
			}
			if (BigDecimal.valueOf(bestBid).compareTo(stopPrice(position.entryPrice(), rules.stopLossPct())) < 0) {
				return Optional.of(ExitReason.STOP_LOSS);
			}
		}
		if (position.direction().breachedBy(referencePrice, strikePrice)) {
			return Optional.of(ExitReason.STRIKE_BARRIER);
		}
		return Optional.empty();
	}

	static BigDecimal stopPrice(BigDecimal entryPrice, double stopLossPct) {
		return entryPrice.multiply(BigDecimal.ONE.subtract(BigDecimal.valueOf(stopLossPct)));
	}
}
