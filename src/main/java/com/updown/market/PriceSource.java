package com.updown.market;

import java.util.List;

import com.updown.market.dto.PriceSample;

import reactor.core.publisher.Mono;

/**
 * One reference price provider. Empty or error means "source unavailable" for this call.
 */
public interface PriceSource {

	String name();

	Mono<Double> latestPrice();

	/**
	 * Most recent one-minute candles, oldest first. Providers without history return empty.
	 */
	Mono<List<PriceSample>> recentCandles(int count);
}
