package com.updown.engine;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.updown.position.PositionState;
import com.updown.strategy.Direction;

class TickLogLineBuilderTest {

	@Test
	void tickLineHasStablePrefixOrderAndPlainDecimals() {
		TickLog dto = new TickLog("btc-updown-15m-1714564800", 9.25, 100_150.0, "binance", 100_000.0,
				Direction.UP, 100_300.0, 100_100.0, 99_900.0, 0.000012, null, 0.25, 90.0, 150.0, 1.0, 0.62, false,
				15, 25, 4, 30, 74, 74, 75, false, false, List.of("DEPTH_RATIO_FLOOR"), PositionState.FLAT,
				TickOutcome.BELOW_THRESHOLD);

		String line = TickLogLineBuilder.buildTickLine(dto);

		assertTrue(line.startsWith("EVENT=TICK window=btc-updown-15m-1714564800 minutesLeft=9.25 price=100150"));
		assertTrue(line.contains(" atr=0.000012 "));
		assertTrue(line.contains(" rsi=NA "));
		assertTrue(line.contains(" failedConstraints=DEPTH_RATIO_FLOOR "));
		assertFalse(line.contains("E-"));
		assertFalse(line.contains("E+"));
		int idxPrice = line.indexOf(" price=");
		int idxTotal = line.indexOf(" total=");
		int idxOutcome = line.indexOf(" outcome=");
		assertTrue(idxPrice < idxTotal && idxTotal < idxOutcome);
	}

	@Test
	void sessionLineRoundsWinRate() {
		String line = TickLogLineBuilder.buildSessionLine(new SessionStats(5, 3, 2, 1));

		assertTrue(line.equals("EVENT=SESSION windows=5 signals=3 wins=2 losses=1 winRate=66.67"), line);
	}
}
