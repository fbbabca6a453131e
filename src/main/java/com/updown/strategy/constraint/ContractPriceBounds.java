package com.updown.strategy.constraint;

/**
 * Favored contract must be priced within {@code [min, max]}. An unknown price fails.
 */
public record ContractPriceBounds(double min, double max) implements HardConstraint {

	public ContractPriceBounds {
		if (min > max) {
			throw new IllegalArgumentException("min " + min + " is above max " + max);
		}
	}

	@Override
	public String name() {
		return "CONTRACT_PRICE_BOUNDS";
	}

	@Override
	public boolean test(GateInput input) {
		Double price = input.contractPrice();
		return price != null && price >= min && price <= max;
	}
}
