package com.updown.strategy;

import java.util.List;

import com.updown.market.dto.PriceSample;

/**
 * Aligns a candle history quoted in a neighbouring unit (USDT) with the live reference (USD) by
 * shifting every value by the gap between the reference and the last close.
 */
public final class CandleRecalibrator {

	private CandleRecalibrator() {
	}

	public static List<PriceSample> alignTo(List<PriceSample> samples, double referencePrice) {
		if (samples == null || samples.isEmpty() || !Double.isFinite(referencePrice)) {
			return samples;
		}
		double offset = referencePrice - samples.get(samples.size() - 1).close();
		if (offset == 0.0) {
			return samples;
		}
		return samples.stream().map(sample -> sample.shifted(offset)).toList();
	}
}
