package com.updown.market;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.updown.market.dto.PriceSample;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Reference price from a preference-ordered list of providers. Providers are asked one after
 * another, each bounded by the per-call timeout; the first answer wins and failures simply fall
 * through to the next provider.
 */
public class RankedPriceFeed {

	private static final Logger LOGGER = LoggerFactory.getLogger(RankedPriceFeed.class);

	private final List<PriceSource> sources;
	private final Duration callTimeout;

	public RankedPriceFeed(List<PriceSource> sources, Duration callTimeout) {
		this.sources = List.copyOf(sources);
		this.callTimeout = callTimeout;
	}

	public static RankedPriceFeed ordered(List<PriceSource> available, List<String> preference, Duration callTimeout) {
		Map<String, PriceSource> byName = available.stream()
				.collect(Collectors.toMap(PriceSource::name, Function.identity(), (first, second) -> first));
		List<PriceSource> ordered = new ArrayList<>();
		for (String name : preference) {
			PriceSource source = byName.remove(name);
			if (source == null) {
				LOGGER.warn("EVENT=PRICE_SOURCE_UNKNOWN name={}", name);
				continue;
			}
			ordered.add(source);
		}
		return new RankedPriceFeed(ordered, callTimeout);
	}

	public List<String> sourceNames() {
		return sources.stream().map(PriceSource::name).toList();
	}

	public int sourceCount() {
		return sources.size();
	}

	public Mono<PriceQuote> latestPrice() {
		return Flux.fromIterable(sources)
				.concatMap(source -> source.latestPrice()
						.filter(price -> Double.isFinite(price) && price > 0)
						.timeout(callTimeout)
						.map(price -> new PriceQuote(source.name(), price))
						.onErrorResume(error -> unavailable(source, "price", error)))
				.next();
	}

	public Mono<List<PriceSample>> recentCandles(int count) {
		return Flux.fromIterable(sources)
				.concatMap(source -> source.recentCandles(count)
						.filter(candles -> !candles.isEmpty())
						.timeout(callTimeout)
						.onErrorResume(error -> unavailable(source, "candles", error)))
				.next();
	}

	private static <T> Mono<T> unavailable(PriceSource source, String what, Throwable error) {
		LOGGER.warn("EVENT=PRICE_SOURCE_UNAVAILABLE source={} data={} error={}", source.name(), what,
				error.getMessage());
		return Mono.empty();
	}

	public record PriceQuote(String source, double price) {
	}
}
