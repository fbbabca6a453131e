package com.updown.exchange;

/**
 * Timeout-class failure: connection reset, read timeout, 5xx or 429 from the venue.
 * Safe to retry with backoff.
 */
public class TransientVenueException extends VenueApiException {

	public TransientVenueException(String message) {
		super("TRANSIENT", null, message);
	}

	public TransientVenueException(Integer httpStatus, String message) {
		super("TRANSIENT", httpStatus, message);
	}

	public TransientVenueException(String message, Throwable cause) {
		super("TRANSIENT", null, message, cause);
	}
}
