package com.updown.strategy.constraint;

import java.util.List;

public record GateResult(List<String> failed) {

	public static final GateResult PASSED = new GateResult(List.of());

	public GateResult {
		failed = failed == null ? List.of() : List.copyOf(failed);
	}

	public boolean passed() {
		return failed.isEmpty();
	}
}
