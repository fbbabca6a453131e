package com.updown.position;

import java.math.BigDecimal;

/**
 * How a window ended for the position state machine. {@code position}, {@code pnl},
 * {@code pnlPct} and {@code stake} are null for {@link WindowResult#NO_SIGNAL}; P&L is also null
 * when the result is {@link WindowResult#UNRESOLVED}.
 */
public record Settlement(
		WindowResult result,
		Position position,
		Double finalPrice,
		BigDecimal exitPrice,
		BigDecimal pnl,
		Double pnlPct,
		BigDecimal stake) {

	public boolean hadPosition() {
		return position != null;
	}
}
