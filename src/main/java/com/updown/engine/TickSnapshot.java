package com.updown.engine;

import java.util.List;
import java.util.Optional;

import com.updown.exchange.dto.ContractBook;
import com.updown.market.RankedPriceFeed.PriceQuote;
import com.updown.market.dto.OrderBookDepthResponse;
import com.updown.market.dto.PriceSample;

/**
 * Whatever the fan-out of one tick managed to read. Every part is optional.
 */
public record TickSnapshot(
		Optional<PriceQuote> reference,
		Optional<List<PriceSample>> candles,
		Optional<ContractBook> upBook,
		Optional<ContractBook> downBook,
		Optional<OrderBookDepthResponse> depth) {

	public static TickSnapshot empty() {
		return new TickSnapshot(Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty(),
				Optional.empty());
	}

	public Optional<Double> referencePrice() {
		return reference.map(PriceQuote::price);
	}
}
