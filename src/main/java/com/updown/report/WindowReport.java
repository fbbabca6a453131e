package com.updown.report;

import java.math.BigDecimal;
import java.time.Instant;

import com.updown.engine.WindowStatistics;
import com.updown.market.MarketWindow;
import com.updown.position.ExitReason;
import com.updown.position.Position;
import com.updown.position.Settlement;
import com.updown.position.WindowResult;
import com.updown.strategy.Direction;

/**
 * One line of the window journal: score averages over the trading sub-window and, when a
 * position existed, how it ended.
 */
public record WindowReport(
		String windowId,
		double strikePrice,
		Instant closeTime,
		Instant recordedAt,
		WindowResult result,
		Direction direction,
		BigDecimal entryPrice,
		BigDecimal exitPrice,
		Double finalPrice,
		BigDecimal pnl,
		Double pnlPct,
		BigDecimal stake,
		ExitReason closeReason,
		int closeAttempts,
		int failedEntries,
		double averageBand,
		double averageBarrier,
		double averageDepth,
		double averageValue,
		double averageTotal,
		int evaluations,
		int signals,
		int blocked,
		int maxScore) {

	public static WindowReport of(MarketWindow window, WindowStatistics statistics, Settlement settlement,
			int failedEntries, Instant recordedAt) {
		Position position = settlement.position();
		return new WindowReport(
				window.id(),
				window.strikePrice(),
				window.closeTime(),
				recordedAt,
				settlement.result(),
				position == null ? null : position.direction(),
				position == null ? null : position.entryPrice(),
				settlement.exitPrice(),
				settlement.finalPrice(),
				settlement.pnl(),
				settlement.pnlPct(),
				settlement.stake(),
				position == null ? null : position.closeReason(),
				position == null ? 0 : position.closeAttempts(),
				failedEntries,
				statistics.averageBand(),
				statistics.averageBarrier(),
				statistics.averageDepth(),
				statistics.averageValue(),
				statistics.averageTotal(),
				statistics.evaluations(),
				statistics.signals(),
				statistics.blocked(),
				statistics.maxScore());
	}
}
