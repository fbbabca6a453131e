package com.updown.strategy.constraint;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.updown.strategy.Direction;

class ConstraintGateTest {

	private final ConstraintGate gate = new ConstraintGate(List.of(new ContractPriceBounds(0.60, 0.85),
			new DepthRatioFloor(2.0)));

	@Test
	void passesWhenEveryConstraintHolds() {
		GateResult result = gate.evaluate(new GateInput(Direction.UP, 0.70, 2.5));

		assertThat(result.passed()).isTrue();
		assertThat(result.failed()).isEmpty();
	}

	@Test
	void namesEveryFailedConstraint() {
		GateResult result = gate.evaluate(new GateInput(Direction.DOWN, 0.90, 1.2));

		assertThat(result.passed()).isFalse();
		assertThat(result.failed()).containsExactly("CONTRACT_PRICE_BOUNDS", "DEPTH_RATIO_FLOOR");
	}

	@Test
	void unknownObservationsFail() {
		GateResult result = gate.evaluate(new GateInput(Direction.UP, null, null));

		assertThat(result.failed()).hasSize(2);
	}

	@Test
	void boundsAreInclusive() {
		ContractPriceBounds bounds = new ContractPriceBounds(0.60, 0.85);

		assertThat(bounds.test(new GateInput(Direction.UP, 0.60, null))).isTrue();
		assertThat(bounds.test(new GateInput(Direction.UP, 0.85, null))).isTrue();
		assertThat(bounds.test(new GateInput(Direction.UP, 0.5999, null))).isFalse();
	}

	@Test
	void emptyGateAlwaysPasses() {
		assertThat(new ConstraintGate(List.of()).evaluate(new GateInput(Direction.UP, null, null)).passed()).isTrue();
	}
}
