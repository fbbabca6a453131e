package com.updown.engine;

public enum TickOutcome {
	/** No reference price; nothing evaluated. */
	SKIPPED,
	OUTSIDE_TRADE_WINDOW,
	BELOW_THRESHOLD,
	/** Score reached the threshold but a hard constraint failed. */
	BLOCKED,
	SIGNAL,
	ENTRY_FAILED,
	HOLDING,
	CLOSE_FAILED,
	CLOSED,
	IDLE
}
