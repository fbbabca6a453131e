package com.updown.position;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

import com.updown.strategy.Direction;

/**
 * The single position a window may hold. Entry values come from the fill; every transition
 * returns a new instance.
 */
public record Position(
		String contractId,
		Direction direction,
		BigDecimal entryPrice,
		BigDecimal size,
		String entryOrderId,
		Instant entryTime,
		int closeAttempts,
		boolean closed,
		ExitReason closeReason,
		BigDecimal closePrice,
		BigDecimal closedSize,
		Instant closeTime) {

	public Position {
		Objects.requireNonNull(contractId, "contractId");
		Objects.requireNonNull(direction, "direction");
		if (entryPrice == null || entryPrice.signum() <= 0) {
			throw new IllegalArgumentException("entry price must be positive");
		}
		if (size == null || size.signum() <= 0) {
			throw new IllegalArgumentException("size must be positive");
		}
	}

	public static Position opened(String contractId, Direction direction, BigDecimal entryPrice, BigDecimal size,
			String orderId, Instant entryTime) {
		return new Position(contractId, direction, entryPrice, size, orderId, entryTime, 0, false, null, null, null,
				null);
	}

	public Position withFailedClose() {
		return new Position(contractId, direction, entryPrice, size, entryOrderId, entryTime, closeAttempts + 1, false,
				closeReason, closePrice, closedSize, closeTime);
	}

	public Position withClose(ExitReason reason, BigDecimal price, BigDecimal soldSize, Instant when) {
		if (closed) {
			throw new IllegalStateException("position on " + contractId + " is already closed");
		}
		return new Position(contractId, direction, entryPrice, size, entryOrderId, entryTime, closeAttempts + 1, true,
				reason, price, soldSize, when);
	}

	public BigDecimal stake() {
		return entryPrice.multiply(size);
	}
}
