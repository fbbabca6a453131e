package com.updown.strategy;

/**
 * Turns one tick's observations into a {@link ScoreBreakdown} for a given profile.
 */
public class ScoreCalculator {

	private static final double BAND_MIDPOINT = 0.5;

	private final ScoringProfile profile;
	private final ScoringParameters parameters;

	public ScoreCalculator(ScoringProfile profile, ScoringParameters parameters) {
		this.profile = profile;
		this.parameters = parameters;
	}

	public ScoringProfile profile() {
		return profile;
	}

	public ScoringParameters parameters() {
		return parameters;
	}

	public ScoreBreakdown score(ScoreInput input) {
		Direction direction = input.direction();
		IndicatorSet indicators = input.indicators() == null ? IndicatorSet.INSUFFICIENT : input.indicators();
		double distance = Math.abs(input.referencePrice() - input.strikePrice());

		Double bandPosition = bandPosition(input.strikePrice(), indicators);
		int band = bandPosition == null ? 0 : bandScore(direction, bandPosition);

		Double maxMove = indicators.atrReady() ? maxMove(indicators.atr(), input.minutesRemaining()) : null;
		int barrier = maxMove == null ? 0 : barrierScore(distance, maxMove);

		int depth = depthScore(input.depthRatio());
		int value = valueScore(input.contractPrice());

		int rawTotal = band + barrier + depth + value;
		boolean killSwitch = killSwitchTriggered(input.contractPrice());
		int total = killSwitch ? 0 : Math.max(0, rawTotal);
		return new ScoreBreakdown(direction, band, barrier, depth, value, rawTotal, total, killSwitch, bandPosition,
				maxMove, distance, input.depthRatio(), input.contractPrice(), indicators.insufficientData());
	}

	/**
	 * Where the strike sits in the channel: 0 at the lower band, 1 at the upper, clamped.
	 */
	static Double bandPosition(double strikePrice, IndicatorSet indicators) {
		if (!indicators.bandsReady()) {
			return null;
		}
		double width = indicators.upper() - indicators.lower();
		if (!(width > 0)) {
			return null;
		}
		return ScoreMath.unitClamp((strikePrice - indicators.lower()) / width);
	}

	int bandScore(Direction direction, double position) {
		if (direction == Direction.UP) {
			return position < BAND_MIDPOINT
					? ScoreMath.weighted(profile.bandWeight(), 1.0 - position / BAND_MIDPOINT)
					: 0;
		}
		return position > BAND_MIDPOINT
				? ScoreMath.weighted(profile.bandWeight(), (position - BAND_MIDPOINT) / BAND_MIDPOINT)
				: 0;
	}

	double maxMove(double atr, double minutesRemaining) {
		return atr * Math.sqrt(Math.max(0.0, minutesRemaining)) * parameters.atrMultiplier();
	}

	int barrierScore(double distance, double maxMove) {
		if (!(maxMove > 0) || distance < maxMove) {
			return 0;
		}
		double span = (parameters.barrierSaturation() - 1.0) * maxMove;
		if (!(span > 0)) {
			return profile.barrierWeight();
		}
		return ScoreMath.weighted(profile.barrierWeight(), (distance - maxMove) / span);
	}

	int depthScore(Double depthRatio) {
		if (depthRatio == null || !Double.isFinite(depthRatio)) {
			return 0;
		}
		return ScoreMath.weighted(profile.depthWeight(),
				ScoreMath.ramp(depthRatio, parameters.depthRatioFloor(), parameters.depthRatioCap()));
	}

	int valueScore(Double contractPrice) {
		if (!ScoreMath.isFinitePositive(contractPrice) || contractPrice < parameters.valueFloorPrice()) {
			return 0;
		}
		if (contractPrice <= parameters.valueFullPrice()) {
			return profile.valueWeight();
		}
		return ScoreMath.weighted(profile.valueWeight(),
				ScoreMath.ramp(contractPrice, parameters.valueZeroPrice(), parameters.valueFullPrice()));
	}

	boolean killSwitchTriggered(Double contractPrice) {
		return profile.killSwitchPrice() != null && contractPrice != null
				&& contractPrice > profile.killSwitchPrice();
	}
}
