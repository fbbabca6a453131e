package com.updown.engine;

import java.time.Duration;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.updown.exchange.ContractBookSource;
import com.updown.market.MarketWindow;
import com.updown.market.RankedPriceFeed;
import com.updown.market.ReferenceDepthSource;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * Issues the independent reads of one tick concurrently on a bounded scheduler and waits for
 * all of them. A read that fails or times out becomes an empty part of the snapshot.
 * <p>
 * Reference price and candles walk the ranked providers one after another, each bounded by the
 * call timeout, so those legs get one call timeout per provider plus one of slack.
 */
public class TickDataFetcher {

	private static final Logger LOGGER = LoggerFactory.getLogger(TickDataFetcher.class);

	private final RankedPriceFeed priceFeed;
	private final ContractBookSource bookSource;
	private final ReferenceDepthSource depthSource;
	private final Scheduler scheduler;
	private final int candleCount;
	private final Duration callTimeout;

	public TickDataFetcher(RankedPriceFeed priceFeed, ContractBookSource bookSource, ReferenceDepthSource depthSource,
			Scheduler scheduler, int candleCount, Duration callTimeout) {
		this.priceFeed = priceFeed;
		this.bookSource = bookSource;
		this.depthSource = depthSource;
		this.scheduler = scheduler;
		this.candleCount = candleCount;
		this.callTimeout = callTimeout;
	}

	public TickSnapshot fetch(MarketWindow window) {
		Duration rankedTimeout = rankedTimeout();
		Mono<TickSnapshot> snapshot = Mono.zip(
				optional("reference", Mono.defer(priceFeed::latestPrice), rankedTimeout),
				optional("candles", Mono.defer(() -> priceFeed.recentCandles(candleCount)), rankedTimeout),
				optional("upBook", Mono.defer(() -> bookSource.fetchBook(window.upContractId())), callTimeout),
				optional("downBook", Mono.defer(() -> bookSource.fetchBook(window.downContractId())), callTimeout),
				optional("depth", Mono.defer(depthSource::fetchReferenceDepth), callTimeout))
				.map(parts -> new TickSnapshot(parts.getT1(), parts.getT2(), parts.getT3(), parts.getT4(),
						parts.getT5()));
		TickSnapshot result = snapshot.block(rankedTimeout.plus(callTimeout));
		return result == null ? TickSnapshot.empty() : result;
	}

	/**
	 * Final reference read at expiry, without the rest of the fan-out.
	 */
	public Optional<Double> fetchReferencePrice() {
		Duration rankedTimeout = rankedTimeout();
		Optional<RankedPriceFeed.PriceQuote> quote = optional("reference", Mono.defer(priceFeed::latestPrice),
				rankedTimeout).block(rankedTimeout.plus(callTimeout));
		return quote == null ? Optional.empty() : quote.map(RankedPriceFeed.PriceQuote::price);
	}

	Duration rankedTimeout() {
		return callTimeout.multipliedBy(Math.max(1, priceFeed.sourceCount()) + 1L);
	}

	private <T> Mono<Optional<T>> optional(String part, Mono<T> call, Duration timeout) {
		return call.subscribeOn(scheduler)
				.timeout(timeout)
				.map(Optional::of)
				.defaultIfEmpty(Optional.empty())
				.onErrorResume(error -> {
					LOGGER.warn("EVENT=DATA_UNAVAILABLE part={} error={}", part, error.toString());
					return Mono.just(Optional.empty());
				});
	}
}
