package com.updown.strategy.constraint;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates every configured constraint; one failure is enough to block the entry.
 * All constraints run even after the first failure so the log names each of them.
 */
public class ConstraintGate {

	private final List<HardConstraint> constraints;

	public ConstraintGate(List<HardConstraint> constraints) {
		this.constraints = List.copyOf(constraints);
	}

	public List<HardConstraint> constraints() {
		return constraints;
	}

	public GateResult evaluate(GateInput input) {
		List<String> failed = new ArrayList<>();
		for (HardConstraint constraint : constraints) {
			if (!constraint.test(input)) {
				failed.add(constraint.name());
			}
		}
		return failed.isEmpty() ? GateResult.PASSED : new GateResult(failed);
	}
}
