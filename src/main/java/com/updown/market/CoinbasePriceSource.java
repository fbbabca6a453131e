package com.updown.market;

import java.util.List;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import com.fasterxml.jackson.databind.JsonNode;
import com.updown.config.VenueProperties;
import com.updown.market.dto.PriceSample;

import reactor.core.publisher.Mono;

@Component
public class CoinbasePriceSource implements PriceSource {

	private final WebClient coinbaseWebClient;
	private final VenueProperties properties;

	public CoinbasePriceSource(@Qualifier("coinbaseWebClient") WebClient coinbaseWebClient,
			VenueProperties properties) {
		this.coinbaseWebClient = coinbaseWebClient;
		this.properties = properties;
	}

	@Override
	public String name() {
		return "coinbase";
	}

	@Override
	public Mono<Double> latestPrice() {
		return coinbaseWebClient
				.get()
				.uri("/v2/prices/{product}/spot", properties.coinbaseProduct())
				.retrieve()
				.bodyToMono(JsonNode.class)
				.flatMap(node -> {
					JsonNode amount = node.path("data").path("amount");
					return amount.isMissingNode() || amount.isNull() ? Mono.empty() : Mono.just(amount.asDouble());
				});
	}

	@Override
	public Mono<List<PriceSample>> recentCandles(int count) {
		return Mono.empty();
	}
}
