package com.updown.position;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;

import org.junit.jupiter.api.Test;

class EntrySizingTest {

	private final EntrySizing sizing = new EntrySizing(BigDecimal.ONE, new BigDecimal("1.05"));

	@Test
	void raisesSizeToMinimumOrderValue() {
		assertThat(sizing.sizeFor(new BigDecimal("0.30"), null)).isEqualByComparingTo("3.5");
		assertThat(sizing.sizeFor(new BigDecimal("0.66"), null)).isEqualByComparingTo("1.5910");
	}

	@Test
	void respectsVenueMinimum() {
		assertThat(sizing.sizeFor(new BigDecimal("0.70"), new BigDecimal("5"))).isEqualByComparingTo("5");
	}

	@Test
	void keepsConfiguredSharesWhenLarger() {
		EntrySizing large = new EntrySizing(new BigDecimal("10.123456"), new BigDecimal("1.05"));

		assertThat(large.sizeFor(new BigDecimal("0.70"), null)).isEqualByComparingTo("10.1234");
	}
}
