package com.updown.engine;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One externally sourced quantity plus the fallback applied when a read comes back empty.
 * Scoped to a single window: a new window starts with nothing remembered.
 */
public final class LastKnown<T> {

	private static final Logger LOGGER = LoggerFactory.getLogger(LastKnown.class);

	private final String name;
	private final FallbackPolicy policy;
	private final T zero;
	private T last;
	private boolean stale;

	private LastKnown(String name, FallbackPolicy policy, T zero) {
		this.name = name;
		this.policy = policy;
		this.zero = zero;
	}

	public static <T> LastKnown<T> reuseLast(String name) {
		return new LastKnown<>(name, FallbackPolicy.REUSE_LAST, null);
	}

	public static <T> LastKnown<T> skipTick(String name) {
		return new LastKnown<>(name, FallbackPolicy.SKIP_TICK, null);
	}

	public static <T> LastKnown<T> treatAsZero(String name, T zero) {
		return new LastKnown<>(name, FallbackPolicy.TREAT_AS_ZERO, zero);
	}

	public Optional<T> resolve(Optional<T> fresh) {
		if (fresh.isPresent()) {
			last = fresh.get();
			stale = false;
			return fresh;
		}
		stale = true;
		LOGGER.debug("EVENT=FALLBACK_APPLIED quantity={} policy={} hasLast={}", name, policy, last != null);
		return switch (policy) {
			case REUSE_LAST -> Optional.ofNullable(last);
			case SKIP_TICK -> Optional.empty();
			case TREAT_AS_ZERO -> Optional.ofNullable(zero);
		};
	}

	/**
	 * True when the most recent {@link #resolve} had no fresh value.
	 */
	public boolean stale() {
		return stale;
	}
}
