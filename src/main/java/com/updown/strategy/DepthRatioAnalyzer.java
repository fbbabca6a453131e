package com.updown.strategy;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.updown.market.dto.OrderBookDepthResponse;

/**
 * Supporting versus opposing liquidity in a narrow band around the reference price. For an
 * {@link Direction#UP} bet the bids just below the price support it and the asks just above
 * oppose it; {@link Direction#DOWN} mirrors that.
 */
public final class DepthRatioAnalyzer {

	private static final Logger LOGGER = LoggerFactory.getLogger(DepthRatioAnalyzer.class);

	static final double NO_OPPOSITION_RATIO = 10.0;

	private DepthRatioAnalyzer() {
	}

	public static Optional<DepthReading> analyze(OrderBookDepthResponse book, double referencePrice,
			Direction direction, Double atr, double scanFraction) {
		if (book == null || !(referencePrice > 0)) {
			return Optional.empty();
		}
		double scan = ScoreMath.isFinitePositive(atr) ? atr : referencePrice * scanFraction;
		double bidVolume = volumeBetween(book.bids(), referencePrice - scan, referencePrice);
		double askVolume = volumeBetween(book.asks(), referencePrice, referencePrice + scan);
		double supporting = direction == Direction.UP ? bidVolume : askVolume;
		double opposing = direction == Direction.UP ? askVolume : bidVolume;
		return Optional.of(new DepthReading(bidVolume, askVolume, ratio(supporting, opposing), direction, scan));
	}

	static double ratio(double supporting, double opposing) {
		if (opposing > 0) {
			return supporting / opposing;
		}
		// an empty band on both sides says nothing about support
		return supporting > 0 ? NO_OPPOSITION_RATIO : 0.0;
	}

	/**
	 * Sum of level quantities with price strictly inside {@code (from, to)}.
	 */
	static double volumeBetween(List<List<String>> levels, double from, double to) {
		if (levels == null) {
			return 0.0;
		}
		double volume = 0.0;
		for (List<String> level : levels) {
			if (level == null || level.size() < 2) {
				continue;
			}
			try {
				double price = Double.parseDouble(level.get(0));
				if (price > from && price < to) {
					volume += Double.parseDouble(level.get(1));
				}
			} catch (NumberFormatException ex) {
				LOGGER.debug("EVENT=DEPTH_LEVEL_SKIPPED level={} reason={}", level, ex.getMessage());
			}
		}
		return volume;
	}
}
