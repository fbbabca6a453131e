package com.updown.strategy.indicators;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import java.util.List;

import org.junit.jupiter.api.Test;

class RelativeStrengthTest {

	@Test
	void boundaryCases() {
		assertEquals(100.0, RelativeStrength.compute(List.of(1.0, 2.0, 3.0), 2).getAsDouble());
		assertEquals(50.0, RelativeStrength.compute(List.of(5.0, 5.0, 5.0), 2).getAsDouble());
		assertEquals(50.0, RelativeStrength.compute(List.of(1.0, 2.0, 1.0), 2).getAsDouble(), 1e-12);
		assertEquals(0.0, RelativeStrength.compute(List.of(3.0, 2.0, 1.0), 2).getAsDouble(), 1e-12);
	}

	@Test
	void shortSeriesIsInsufficient() {
		assertFalse(RelativeStrength.compute(List.of(1.0, 2.0), 2).isPresent());
	}
}
