package com.updown.engine;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.Instant;

import org.junit.jupiter.api.Test;

import com.updown.position.Position;
import com.updown.position.Settlement;
import com.updown.position.WindowResult;
import com.updown.strategy.Direction;

class SessionStatsTest {

	private final Position position = Position.opened("up-token", Direction.UP, new BigDecimal("0.70"),
			BigDecimal.ONE, "o-1", Instant.EPOCH);

	@Test
	void countsWindowsSignalsAndOutcomes() {
		SessionStats stats = SessionStats.EMPTY
				.after(settlement(WindowResult.NO_SIGNAL, null))
				.after(settlement(WindowResult.WIN, new BigDecimal("0.30")))
				.after(settlement(WindowResult.LOSS, new BigDecimal("-0.70")))
				.after(settlement(WindowResult.UNRESOLVED, null));

		assertThat(stats).isEqualTo(new SessionStats(4, 3, 1, 1));
		assertThat(stats.winRate()).isEqualTo(50.0);
	}

	@Test
	void closedPositionCountsByRealizedPnl() {
		SessionStats stats = SessionStats.EMPTY
				.after(settlement(WindowResult.CLOSED, new BigDecimal("0.20")))
				.after(settlement(WindowResult.CLOSED, new BigDecimal("-0.10")));

		assertThat(stats.wins()).isEqualTo(1);
		assertThat(stats.losses()).isEqualTo(1);
	}

	@Test
	void winRateWithoutDecidedWindowsIsZero() {
		assertThat(SessionStats.EMPTY.winRate()).isZero();
	}

	private Settlement settlement(WindowResult result, BigDecimal pnl) {
		Position held = result == WindowResult.NO_SIGNAL ? null : position;
		return new Settlement(result, held, 100_000.0, null, pnl, null, null);
	}
}
