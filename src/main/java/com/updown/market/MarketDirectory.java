package com.updown.market;

import reactor.core.publisher.Mono;

public interface MarketDirectory {

	/**
	 * The currently tradable window, or empty when none can be resolved (no listing yet, no
	 * strike published, contract ids missing).
	 */
	Mono<MarketWindow> findActiveWindow();
}
