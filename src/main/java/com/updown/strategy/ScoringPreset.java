package com.updown.strategy;

/**
 * Named weight schemes. {@link #DOUBLE_BARRIER} is the default.
 */
public enum ScoringPreset {

	DOUBLE_BARRIER(new ScoringProfile(30, 25, 15, 30, 75, 0.92)),
	BARRIER_ONLY(new ScoringProfile(50, 50, 0, 0, 60, null)),
	VALUE_GUARDED(new ScoringProfile(25, 25, 20, 30, 80, 0.85));

	private final ScoringProfile profile;

	ScoringPreset(ScoringProfile profile) {
		this.profile = profile;
	}

	public ScoringProfile profile() {
		return profile;
	}
}
