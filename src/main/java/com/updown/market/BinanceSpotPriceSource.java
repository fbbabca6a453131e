package com.updown.market;

import java.util.ArrayList;
import java.util.List;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import com.fasterxml.jackson.databind.JsonNode;
import com.updown.config.VenueProperties;
import com.updown.market.dto.OrderBookDepthResponse;
import com.updown.market.dto.PriceSample;

import reactor.core.publisher.Mono;

@Component
public class BinanceSpotPriceSource implements PriceSource, ReferenceDepthSource {

	private final WebClient binanceWebClient;
	private final VenueProperties properties;

	public BinanceSpotPriceSource(@Qualifier("binanceWebClient") WebClient binanceWebClient,
			VenueProperties properties) {
		this.binanceWebClient = binanceWebClient;
		this.properties = properties;
	}

	@Override
	public String name() {
		return "binance";
	}

	@Override
	public Mono<Double> latestPrice() {
		return binanceWebClient
				.get()
				.uri(uriBuilder -> uriBuilder
						.path("/api/v3/ticker/price")
						.queryParam("symbol", properties.referenceSymbol())
						.build())
				.retrieve()
				.bodyToMono(JsonNode.class)
				.flatMap(node -> node.hasNonNull("price")
						? Mono.just(node.get("price").asDouble())
						: Mono.empty());
	}

	@Override
	public Mono<List<PriceSample>> recentCandles(int count) {
		return binanceWebClient
				.get()
				.uri(uriBuilder -> uriBuilder
						.path("/api/v3/klines")
						.queryParam("symbol", properties.referenceSymbol())
						.queryParam("interval", "1m")
						.queryParam("limit", count)
						.build())
				.retrieve()
				.bodyToMono(JsonNode.class)
				.map(BinanceSpotPriceSource::parseKlines)
				.filter(candles -> !candles.isEmpty());
	}

	@Override
	public Mono<OrderBookDepthResponse> fetchReferenceDepth() {
		return binanceWebClient
				.get()
				.uri(uriBuilder -> uriBuilder
						.path("/api/v3/depth")
						.queryParam("symbol", properties.referenceSymbol())
						.queryParam("limit", properties.referenceDepthLimit() > 0 ? properties.referenceDepthLimit() : 1000)
						.build())
				.retrieve()
				.bodyToMono(OrderBookDepthResponse.class);
	}

	static List<PriceSample> parseKlines(JsonNode node) {
		if (node == null || !node.isArray()) {
			return List.of();
		}
		List<PriceSample> klines = new ArrayList<>();
		for (JsonNode entry : node) {
			if (!entry.isArray() || entry.size() < 7) {
				continue;
			}
			long openTime = entry.get(0).asLong();
			double open = entry.get(1).asDouble();
			double high = entry.get(2).asDouble();
			double low = entry.get(3).asDouble();
			double close = entry.get(4).asDouble();
			klines.add(new PriceSample(open, high, low, close, openTime));
		}
		return klines;
	}
}
