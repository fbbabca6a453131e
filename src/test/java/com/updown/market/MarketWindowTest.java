package com.updown.market;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;

import org.junit.jupiter.api.Test;

class MarketWindowTest {

	private static final Instant OPEN = Instant.parse("2024-05-01T12:00:00Z");
	private static final Instant CLOSE = Instant.parse("2024-05-01T12:15:00Z");

	@Test
	void reportsRemainingMinutesAndExpiry() {
		MarketWindow window = new MarketWindow("btc-updown-15m-1714564800", 64000.0, OPEN, CLOSE, "up", "down");

		assertThat(window.minutesRemaining(OPEN.plusSeconds(330))).isEqualTo(9.5);
		assertThat(window.isExpired(CLOSE.minusMillis(1))).isFalse();
		assertThat(window.isExpired(CLOSE)).isTrue();
		assertThat(window.minutesRemaining(CLOSE.plusSeconds(60))).isNegative();
	}

	@Test
	void rejectsInvalidWindows() {
		assertThatThrownBy(() -> new MarketWindow("w", 0.0, OPEN, CLOSE, "up", "down"))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> new MarketWindow("w", 64000.0, CLOSE, OPEN, "up", "down"))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> new MarketWindow("w", 64000.0, OPEN, CLOSE, "up", " "))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> new MarketWindow(" ", 64000.0, OPEN, CLOSE, "up", "down"))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
