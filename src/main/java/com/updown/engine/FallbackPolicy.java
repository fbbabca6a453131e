package com.updown.engine;

/**
 * What a consumer does when an external quantity could not be read this tick.
 */
public enum FallbackPolicy {
	/** Use the last value read earlier in the same window, if any. */
	REUSE_LAST,
	/** Give up on the whole tick. */
	SKIP_TICK,
	/** Substitute the neutral value. */
	TREAT_AS_ZERO
}
