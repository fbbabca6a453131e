package com.updown.strategy.constraint;

/**
 * Named pass/fail rule checked on every entry decision, independently of the score.
 */
public interface HardConstraint {

	String name();

	boolean test(GateInput input);
}
