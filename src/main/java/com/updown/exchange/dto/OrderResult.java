package com.updown.exchange.dto;

import java.math.BigDecimal;

public record OrderResult(
		boolean success,
		String orderId,
		BigDecimal filledSize,
		BigDecimal fillPrice,
		String rejectReason) {

	public static OrderResult filled(String orderId, BigDecimal filledSize, BigDecimal fillPrice) {
		return new OrderResult(true, orderId, filledSize, fillPrice, null);
	}

	public static OrderResult rejected(String reason) {
		return new OrderResult(false, null, BigDecimal.ZERO, null, reason);
	}

	public boolean hasFill() {
		return success && filledSize != null && filledSize.signum() > 0 && fillPrice != null
				&& fillPrice.signum() > 0;
	}
}
