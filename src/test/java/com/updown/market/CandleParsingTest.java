package com.updown.market;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.updown.market.dto.PriceSample;

class CandleParsingTest {

	private final ObjectMapper objectMapper = new ObjectMapper();

	@Test
	void parsesBinanceKlinesAndSkipsShortRows() throws Exception {
		String json = """
				[[1714564800000,"64000.0","64100.0","63950.0","64050.0","12.3",1714564859999],
				 [1714564860000,"64050.0"],
				 [1714564860000,"64050.0","64080.0","64010.0","64020.0","8.1",1714564919999]]
				""";

		List<PriceSample> candles = BinanceSpotPriceSource.parseKlines(objectMapper.readTree(json));

		assertThat(candles).hasSize(2);
		assertThat(candles.get(0)).isEqualTo(new PriceSample(64000.0, 64100.0, 63950.0, 64050.0, 1714564800000L));
		assertThat(candles.get(1).close()).isEqualTo(64020.0);
	}

	@Test
	void keepsMostRecentKrakenRowsInMillis() throws Exception {
		String json = """
				[[1714564740,"63990.0","64010.0","63980.0","64000.0","64000.0","1.0",10],
				 [1714564800,"64000.0","64100.0","63950.0","64050.0","64020.0","2.0",12],
				 [1714564860,"64050.0","64080.0","64010.0","64020.0","64030.0","1.5",9]]
				""";

		List<PriceSample> candles = KrakenPriceSource.parseOhlc(objectMapper.readTree(json), 2);

		assertThat(candles).extracting(PriceSample::timestamp).containsExactly(1714564800000L, 1714564860000L);
	}

	@Test
	void nonArrayPayloadsYieldNothing() throws Exception {
		assertThat(BinanceSpotPriceSource.parseKlines(objectMapper.readTree("{\"code\":-1121}"))).isEmpty();
		assertThat(KrakenPriceSource.parseOhlc(null, 5)).isEmpty();
	}
}
