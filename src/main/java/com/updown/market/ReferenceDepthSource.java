package com.updown.market;

import com.updown.market.dto.OrderBookDepthResponse;

import reactor.core.publisher.Mono;

public interface ReferenceDepthSource {

	Mono<OrderBookDepthResponse> fetchReferenceDepth();
}
