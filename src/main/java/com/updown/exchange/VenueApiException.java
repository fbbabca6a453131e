package com.updown.exchange;

public class VenueApiException extends RuntimeException {

	private final String code;
	private final Integer httpStatus;

	public VenueApiException(String code, Integer httpStatus, String message) {
		super(message);
		this.code = code;
		this.httpStatus = httpStatus;
	}

	public VenueApiException(String code, Integer httpStatus, String message, Throwable cause) {
		super(message, cause);
		this.code = code;
		this.httpStatus = httpStatus;
	}

	public String code() {
		return code;
	}

	public Integer httpStatus() {
		return httpStatus;
	}
}
