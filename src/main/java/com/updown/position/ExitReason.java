package com.updown.position;

/**
 * Close triggers, declared in the order they are checked.
 */
public enum ExitReason {
	TAKE_PROFIT,
	STOP_LOSS,
	STRIKE_BARRIER
}
