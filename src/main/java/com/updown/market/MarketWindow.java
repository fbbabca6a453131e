package com.updown.market;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One up/down contract market instance. The strike is fixed for the life of the window.
 */
public record MarketWindow(
		String id,
		double strikePrice,
		Instant openTime,
		Instant closeTime,
		String upContractId,
		String downContractId) {

	public MarketWindow {
		if (id == null || id.isBlank()) {
			throw new IllegalArgumentException("window id is required");
		}
		if (!Double.isFinite(strikePrice) || strikePrice <= 0) {
			throw new IllegalArgumentException("strike price must be positive, got " + strikePrice);
		}
		Objects.requireNonNull(openTime, "openTime");
		Objects.requireNonNull(closeTime, "closeTime");
		if (!closeTime.isAfter(openTime)) {
			throw new IllegalArgumentException("closeTime must be after openTime");
		}
		if (upContractId == null || upContractId.isBlank() || downContractId == null || downContractId.isBlank()) {
			throw new IllegalArgumentException("both contract ids are required");
		}
	}

	public double minutesRemaining(Instant now) {
		return Duration.between(now, closeTime).toMillis() / 60_000.0;
	}

	public boolean isExpired(Instant now) {
		return !now.isBefore(closeTime);
	}
}
