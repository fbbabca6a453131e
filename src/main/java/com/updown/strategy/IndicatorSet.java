package com.updown.strategy;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

import com.updown.market.dto.PriceSample;
import com.updown.strategy.indicators.AverageTrueRange;
import com.updown.strategy.indicators.BollingerBands;
import com.updown.strategy.indicators.RelativeStrength;

/**
 * Indicator values for one tick. Any field may be null when the history is too short for it;
 * callers check the {@code *Ready} accessors instead of treating that as an error.
 */
public record IndicatorSet(
		Double upper,
		Double middle,
		Double lower,
		Double atr,
		Double rsi,
		int samples) {

	public static final IndicatorSet INSUFFICIENT = new IndicatorSet(null, null, null, null, null, 0);

	public static IndicatorSet from(List<PriceSample> samples, IndicatorSettings settings) {
		if (samples == null || samples.isEmpty()) {
			return INSUFFICIENT;
		}
		List<Double> closes = samples.stream().map(PriceSample::close).toList();
		List<Double> highs = samples.stream().map(PriceSample::high).toList();
		List<Double> lows = samples.stream().map(PriceSample::low).toList();
		Optional<BollingerBands.Bands> bands = BollingerBands.compute(closes, settings.bollingerPeriod(),
				settings.bollingerStdDev());
		OptionalDouble atr = AverageTrueRange.compute(highs, lows, closes, settings.atrPeriod());
		OptionalDouble rsi = RelativeStrength.compute(closes, settings.rsiPeriod());
		return new IndicatorSet(
				bands.map(BollingerBands.Bands::upper).orElse(null),
				bands.map(BollingerBands.Bands::middle).orElse(null),
				bands.map(BollingerBands.Bands::lower).orElse(null),
				atr.isPresent() ? atr.getAsDouble() : null,
				rsi.isPresent() ? rsi.getAsDouble() : null,
				samples.size());
	}

	public boolean bandsReady() {
		return upper != null && lower != null && middle != null;
	}

	public boolean atrReady() {
		return atr != null;
	}

	public boolean insufficientData() {
		return !bandsReady() || !atrReady();
	}
}
