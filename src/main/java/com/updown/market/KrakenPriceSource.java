package com.updown.market;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import com.fasterxml.jackson.databind.JsonNode;
import com.updown.config.VenueProperties;
import com.updown.market.dto.PriceSample;

import reactor.core.publisher.Mono;

@Component
public class KrakenPriceSource implements PriceSource {

	private final WebClient krakenWebClient;
	private final VenueProperties properties;

	public KrakenPriceSource(@Qualifier("krakenWebClient") WebClient krakenWebClient, VenueProperties properties) {
		this.krakenWebClient = krakenWebClient;
		this.properties = properties;
	}

	@Override
	public String name() {
		return "kraken";
	}

	@Override
	public Mono<Double> latestPrice() {
		return krakenWebClient
				.get()
				.uri(uriBuilder -> uriBuilder
						.path("/0/public/Ticker")
						.queryParam("pair", properties.krakenPair())
						.build())
				.retrieve()
				.bodyToMono(JsonNode.class)
				.flatMap(node -> Mono.justOrEmpty(firstResult(node)))
				.flatMap(pair -> {
					JsonNode last = pair.path("c").path(0);
					return last.isMissingNode() ? Mono.empty() : Mono.just(last.asDouble());
				});
	}

	@Override
	public Mono<List<PriceSample>> recentCandles(int count) {
		return krakenWebClient
				.get()
				.uri(uriBuilder -> uriBuilder
						.path("/0/public/OHLC")
						.queryParam("pair", properties.krakenPair())
						.queryParam("interval", 1)
						.build())
				.retrieve()
				.bodyToMono(JsonNode.class)
				.flatMap(node -> Mono.justOrEmpty(firstResult(node)))
				.map(rows -> parseOhlc(rows, count))
				.filter(candles -> !candles.isEmpty());
	}

	private static JsonNode firstResult(JsonNode node) {
		if (node == null || node.path("error").size() > 0) {
			return null;
		}
		Iterator<Map.Entry<String, JsonNode>> fields = node.path("result").fields();
		while (fields.hasNext()) {
			Map.Entry<String, JsonNode> field = fields.next();
			if (!"last".equals(field.getKey())) {
				return field.getValue();
			}
		}
		return null;
	}

	static List<PriceSample> parseOhlc(JsonNode rows, int count) {
		if (rows == null || !rows.isArray()) {
			return List.of();
		}
		List<PriceSample> candles = new ArrayList<>();
		int start = Math.max(0, rows.size() - count);
		for (int i = start; i < rows.size(); i++) {
			JsonNode row = rows.get(i);
			if (!row.isArray() || row.size() < 5) {
				continue;
			}
			long time = row.get(0).asLong() * 1000L;
			candles.add(new PriceSample(row.get(1).asDouble(), row.get(2).asDouble(), row.get(3).asDouble(),
					row.get(4).asDouble(), time));
		}
		return candles;
	}
}
