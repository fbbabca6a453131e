package com.updown.engine;

import java.math.BigDecimal;
import java.util.List;

import com.updown.report.WindowReport;

public final class TickLogLineBuilder {

	private TickLogLineBuilder() {
	}

	public static String buildTickLine(TickLog dto) {
		StringBuilder builder = new StringBuilder(512);
		builder.append("EVENT=TICK")
				.append(" window=").append(na(dto.windowId()))
				.append(" minutesLeft=").append(num(dto.minutesLeft()))
				.append(" price=").append(num(dto.referencePrice()))
				.append(" source=").append(na(dto.referenceSource()))
				.append(" strike=").append(num(dto.strikePrice()))
				.append(" direction=").append(na(dto.direction()))
				.append(" upper=").append(num(dto.upper()))
				.append(" middle=").append(num(dto.middle()))
				.append(" lower=").append(num(dto.lower()))
				.append(" atr=").append(num(dto.atr()))
				.append(" rsi=").append(num(dto.rsi()))
				.append(" bandPosition=").append(num(dto.bandPosition()))
				.append(" maxMove=").append(num(dto.maxMove()))
				.append(" distance=").append(num(dto.distance()))
				.append(" depthRatio=").append(num(dto.depthRatio()))
				.append(" contractPrice=").append(num(dto.contractPrice()))
				.append(" contractPriceStale=").append(dto.contractPriceStale())
				.append(" band=").append(na(dto.bandScore()))
				.append(" barrier=").append(na(dto.barrierScore()))
				.append(" depth=").append(na(dto.depthScore()))
				.append(" value=").append(na(dto.valueScore()))
				.append(" rawTotal=").append(na(dto.rawTotal()))
				.append(" total=").append(na(dto.total()))
				.append(" threshold=").append(na(dto.threshold()))
				.append(" killSwitch=").append(dto.killSwitch())
				.append(" insufficientData=").append(dto.insufficientData())
				.append(" failedConstraints=").append(list(dto.failedConstraints()))
				.append(" state=").append(na(dto.state()))
				.append(" outcome=").append(na(dto.outcome()));
		return builder.toString();
	}

	public static String buildWindowLine(WindowReport report) {
		StringBuilder builder = new StringBuilder(384);
		builder.append("EVENT=WINDOW_RESOLVED")
				.append(" window=").append(na(report.windowId()))
				.append(" strike=").append(num(report.strikePrice()))
				.append(" result=").append(na(report.result()))
				.append(" direction=").append(na(report.direction()))
				.append(" entryPrice=").append(num(report.entryPrice()))
				.append(" exitPrice=").append(num(report.exitPrice()))
				.append(" finalPrice=").append(num(report.finalPrice()))
				.append(" pnl=").append(num(report.pnl()))
				.append(" pnlPct=").append(num(report.pnlPct()))
				.append(" closeReason=").append(na(report.closeReason()))
				.append(" closeAttempts=").append(report.closeAttempts())
				.append(" failedEntries=").append(report.failedEntries())
				.append(" evaluations=").append(report.evaluations())
				.append(" signals=").append(report.signals())
				.append(" blocked=").append(report.blocked())
				.append(" maxScore=").append(report.maxScore())
				.append(" avgTotal=").append(num(report.averageTotal()));
		return builder.toString();
	}

	public static String buildSessionLine(SessionStats stats) {
		StringBuilder builder = new StringBuilder(128);
		builder.append("EVENT=SESSION")
				.append(" windows=").append(stats.windows())
				.append(" signals=").append(stats.signals())
				.append(" wins=").append(stats.wins())
				.append(" losses=").append(stats.losses())
				.append(" winRate=").append(num(round(stats.winRate())));
		return builder.toString();
	}

	private static Double round(double value) {
		return Math.round(value * 100.0) / 100.0;
	}

	private static String list(List<String> values) {
		if (values == null || values.isEmpty()) {
			return "NONE";
		}
		return String.join(",", values);
	}

	private static String na(Object value) {
		if (value == null) {
			return "NA";
		}
		String text = value.toString();
		return text.isBlank() ? "NA" : text;
	}

	private static String num(BigDecimal value) {
		return value == null ? "NA" : value.stripTrailingZeros().toPlainString();
	}

	private static String num(Double value) {
		if (value == null || value.isNaN() || value.isInfinite()) {
			return "NA";
		}
		return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
	}
}
