package com.updown.exchange;

/**
 * Application-level refusal of an order (insufficient balance or allowance, market already
 * settled, size below the venue minimum). Terminal for the attempt that raised it.
 */
public class OrderRejectedException extends VenueApiException {

	public OrderRejectedException(String code, String message) {
		super(code, null, message);
	}

	public OrderRejectedException(String code, Integer httpStatus, String message) {
		super(code, httpStatus, message);
	}
}
