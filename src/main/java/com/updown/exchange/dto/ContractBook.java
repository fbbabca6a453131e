package com.updown.exchange.dto;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

public record ContractBook(
		String contractId,
		List<BookLevel> bids,
		List<BookLevel> asks,
		BigDecimal minOrderSize) {

	public ContractBook {
		bids = bids == null ? List.of() : List.copyOf(bids);
		asks = asks == null ? List.of() : List.copyOf(asks);
	}

	public Optional<BigDecimal> bestAsk() {
		return asks.stream()
				.map(BookLevel::price)
				.filter(price -> price != null && price.signum() > 0)
				.min(Comparator.naturalOrder());
	}

	public Optional<BigDecimal> bestBid() {
		return bids.stream()
				.map(BookLevel::price)
				.filter(price -> price != null && price.signum() > 0)
				.max(Comparator.naturalOrder());
	}
}
