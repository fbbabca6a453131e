package com.updown.strategy.indicators;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

class BollingerBandsTest {

	@Test
	void usesPopulationDeviationOverTheLastPeriod() {
		Optional<BollingerBands.Bands> bands = BollingerBands.compute(List.of(100.0, 1.0, 2.0, 3.0, 4.0, 5.0), 5, 2.0);

		assertThat(bands).isPresent();
		assertThat(bands.get().middle()).isEqualTo(3.0);
		assertThat(bands.get().upper()).isCloseTo(3.0 + 2.0 * Math.sqrt(2.0), within(1e-12));
		assertThat(bands.get().lower()).isCloseTo(3.0 - 2.0 * Math.sqrt(2.0), within(1e-12));
	}

	@Test
	void shortSeriesIsInsufficient() {
		assertThat(BollingerBands.compute(List.of(1.0, 2.0, 3.0, 4.0), 5, 2.0)).isEmpty();
		assertThat(BollingerBands.compute(List.of(), 20, 2.0)).isEmpty();
		assertThat(BollingerBands.compute(null, 20, 2.0)).isEmpty();
	}

	@Test
	void repeatedCallsReturnIdenticalValues() {
		List<Double> closes = List.of(101.3, 99.7, 100.2, 102.9, 98.4, 100.0, 101.1);

		assertThat(BollingerBands.compute(closes, 5, 2.0)).isEqualTo(BollingerBands.compute(closes, 5, 2.0));
	}
}
