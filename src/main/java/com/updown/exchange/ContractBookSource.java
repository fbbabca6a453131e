package com.updown.exchange;

import com.updown.exchange.dto.ContractBook;

import reactor.core.publisher.Mono;

public interface ContractBookSource {

	/**
	 * Top of book and depth for one outcome contract. Empty when the venue has no book for it.
	 */
	Mono<ContractBook> fetchBook(String contractId);
}
