package com.updown.strategy;

public record IndicatorSettings(
		int bollingerPeriod,
		double bollingerStdDev,
		int atrPeriod,
		int rsiPeriod) {
}
