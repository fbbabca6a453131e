package com.updown.engine;

import com.updown.position.Settlement;

/**
 * Counters across windows, threaded through the engine loop. Only the loop thread replaces it.
 */
public record SessionStats(int windows, int signals, int wins, int losses) {

	public static final SessionStats EMPTY = new SessionStats(0, 0, 0, 0);

	public SessionStats after(Settlement settlement) {
		return switch (settlement.result()) {
			case NO_SIGNAL -> new SessionStats(windows + 1, signals, wins, losses);
			case WIN -> new SessionStats(windows + 1, signals + 1, wins + 1, losses);
			case LOSS -> new SessionStats(windows + 1, signals + 1, wins, losses + 1);
			case CLOSED -> closedAfter(settlement);
			case UNRESOLVED -> new SessionStats(windows + 1, signals + 1, wins, losses);
		};
	}

	private SessionStats closedAfter(Settlement settlement) {
		boolean profit = settlement.pnl() != null && settlement.pnl().signum() > 0;
		return new SessionStats(windows + 1, signals + 1, wins + (profit ? 1 : 0), losses + (profit ? 0 : 1));
	}

	public double winRate() {
		int decided = wins + losses;
		return decided == 0 ? 0.0 : wins * 100.0 / decided;
	}
}
