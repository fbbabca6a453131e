package com.updown.market.dto;

public record PriceSample(
		double open,
		double high,
		double low,
		double close,
		long timestamp) {

	public PriceSample shifted(double offset) {
		return new PriceSample(open + offset, high + offset, low + offset, close + offset, timestamp);
	}
}
