package com.updown.engine;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.updown.exchange.dto.ContractBook;
import com.updown.market.MarketWindow;
import com.updown.market.dto.OrderBookDepthResponse;
import com.updown.market.dto.PriceSample;
import com.updown.position.CloseOutcome;
import com.updown.position.EntryOutcome;
import com.updown.position.ExitReason;
import com.updown.position.Position;
import com.updown.position.PositionStateMachine;
import com.updown.position.Settlement;
import com.updown.report.ReportSink;
import com.updown.report.WindowReport;
import com.updown.strategy.CandleRecalibrator;
import com.updown.strategy.DepthRatioAnalyzer;
import com.updown.strategy.DepthReading;
import com.updown.strategy.Direction;
import com.updown.strategy.IndicatorSet;
import com.updown.strategy.IndicatorSettings;
import com.updown.strategy.ScoreBreakdown;
import com.updown.strategy.ScoreCalculator;
import com.updown.strategy.ScoreInput;
import com.updown.strategy.constraint.ConstraintGate;
import com.updown.strategy.constraint.GateInput;
import com.updown.strategy.constraint.GateResult;

/**
 * Drives one market window from discovery to expiry: fixed-interval ticks, entry evaluation
 * inside the trading sub-window, exit checks while a position is open, settlement and report at
 * the end. Ticks are strictly sequential on the calling thread.
 */
public class WindowRunner {

	private static final Logger LOGGER = LoggerFactory.getLogger(WindowRunner.class);

	private static final OrderBookDepthResponse EMPTY_DEPTH = new OrderBookDepthResponse(0L, List.of(), List.of());

	private final TickDataFetcher fetcher;
	private final ScoreCalculator calculator;
	private final ConstraintGate gate;
	private final IndicatorSettings indicatorSettings;
	private final boolean recalibrateCandles;
	private final TradeWindow tradeWindow;
	private final Duration tickInterval;
	private final Function<MarketWindow, PositionStateMachine> machineFactory;
	private final ReportSink reportSink;
	private final Clock clock;
	private final Sleeper sleeper;

	public WindowRunner(TickDataFetcher fetcher, ScoreCalculator calculator, ConstraintGate gate,
			IndicatorSettings indicatorSettings, boolean recalibrateCandles, TradeWindow tradeWindow,
			Duration tickInterval, Function<MarketWindow, PositionStateMachine> machineFactory, ReportSink reportSink,
			Clock clock, Sleeper sleeper) {
		this.fetcher = fetcher;
		this.calculator = calculator;
		this.gate = gate;
		this.indicatorSettings = indicatorSettings;
		this.recalibrateCandles = recalibrateCandles;
		this.tradeWindow = tradeWindow;
		this.tickInterval = tickInterval;
		this.machineFactory = machineFactory;
		this.reportSink = reportSink;
		this.clock = clock;
		this.sleeper = sleeper;
	}

	public WindowOutcome run(MarketWindow window) throws InterruptedException {
		WindowRun run = new WindowRun(window, machineFactory.apply(window));
		LOGGER.info("EVENT=WINDOW_START window={} strike={} closeTime={} minutesLeft={} tradeWindow={}-{}",
				window.id(), window.strikePrice(), window.closeTime(),
				String.format("%.2f", window.minutesRemaining(clock.instant())), tradeWindow.minMinutes(),
				tradeWindow.maxMinutes());
		while (!window.isExpired(clock.instant())) {
			try {
				tick(run);
			} catch (RuntimeException ex) {
				LOGGER.error("EVENT=TICK_ERROR window={} message={}", window.id(), ex.getMessage(), ex);
			}
			Duration untilClose = Duration.between(clock.instant(), window.closeTime());
			if (untilClose.isNegative() || untilClose.isZero()) {
				break;
			}
			sleeper.sleep(untilClose.compareTo(tickInterval) < 0 ? untilClose : tickInterval);
		}
		return resolve(run);
	}

	TickOutcome tick(WindowRun run) {
		MarketWindow window = run.window;
		PositionStateMachine machine = run.machine;
		Instant now = clock.instant();
		double minutesLeft = window.minutesRemaining(now);
		TickSnapshot snapshot = fetcher.fetch(window);

		Optional<Double> reference = run.referencePrice.resolve(snapshot.referencePrice());
		Optional<BigDecimal> upAsk = run.upAsk.resolve(snapshot.upBook().flatMap(ContractBook::bestAsk));
		Optional<BigDecimal> downAsk = run.downAsk.resolve(snapshot.downBook().flatMap(ContractBook::bestAsk));
		Optional<BigDecimal> upBid = run.upBid.resolve(snapshot.upBook().flatMap(ContractBook::bestBid));
		Optional<BigDecimal> downBid = run.downBid.resolve(snapshot.downBook().flatMap(ContractBook::bestBid));
		if (reference.isEmpty()) {
			LOGGER.warn("EVENT=TICK_SKIPPED window={} reason=NO_REFERENCE_PRICE minutesLeft={}", window.id(),
					String.format("%.2f", minutesLeft));
			return TickOutcome.SKIPPED;
		}
		double price = reference.get();
		run.lastReference = price;

		if (machine.isOpen()) {
			Position position = machine.position().orElseThrow();
			Optional<BigDecimal> bid = position.direction() == Direction.UP ? upBid : downBid;
			return manageOpenPosition(run, bid.orElse(null), price, now);
		}
		if (!machine.canEnter()) {
			return TickOutcome.IDLE;
		}
		if (!tradeWindow.contains(minutesLeft)) {
			announceOutside(run, minutesLeft);
			return TickOutcome.OUTSIDE_TRADE_WINDOW;
		}
		if (!run.announcedOpen) {
			run.announcedOpen = true;
			LOGGER.info("EVENT=TRADE_WINDOW_OPEN window={} minutesLeft={}", window.id(),
					String.format("%.2f", minutesLeft));
		}
		if (!run.announcedEnding && minutesLeft <= tradeWindow.minMinutes() + 1.0) {
			run.announcedEnding = true;
			LOGGER.info("EVENT=TRADE_WINDOW_ENDING window={} minutesLeft={}", window.id(),
					String.format("%.2f", minutesLeft));
		}

		List<PriceSample> candles = snapshot.candles()
				.map(samples -> recalibrateCandles ? CandleRecalibrator.alignTo(samples, price) : samples)
				.orElse(List.of());
		IndicatorSet indicators = IndicatorSet.from(candles, indicatorSettings);
		Direction direction = Direction.favored(price, window.strikePrice());
		Optional<BigDecimal> ask = direction == Direction.UP ? upAsk : downAsk;
		boolean askStale = direction == Direction.UP ? run.upAsk.stale() : run.downAsk.stale();
		Double contractPrice = ask.map(BigDecimal::doubleValue).orElse(null);
		Double depthRatio = run.depth.resolve(snapshot.depth())
				.flatMap(book -> DepthRatioAnalyzer.analyze(book, price, direction, indicators.atr(),
						calculator.parameters().depthScanFraction()))
				.map(DepthReading::ratio)
				.orElse(null);

		ScoreBreakdown breakdown = calculator.score(new ScoreInput(price, window.strikePrice(), indicators,
				minutesLeft, contractPrice, depthRatio));
		GateResult gateResult = gate.evaluate(new GateInput(direction, contractPrice, depthRatio));
		int threshold = calculator.profile().threshold();
		TickOutcome outcome;
		if (!breakdown.meetsThreshold(threshold)) {
			outcome = TickOutcome.BELOW_THRESHOLD;
		} else if (!gateResult.passed()) {
			outcome = TickOutcome.BLOCKED;
		} else {
			outcome = TickOutcome.SIGNAL;
		}

		if (outcome == TickOutcome.SIGNAL) {
			LOGGER.info("EVENT=SIGNAL window={} direction={} score={} threshold={} contractPrice={}", window.id(),
					direction, breakdown.total(), threshold, contractPrice);
			BigDecimal venueMinimum = (direction == Direction.UP ? snapshot.upBook() : snapshot.downBook())
					.map(ContractBook::minOrderSize)
					.orElse(null);
			EntryOutcome entry = machine.enter(direction, ask.orElse(null), venueMinimum, now);
			if (!entry.filled()) {
				outcome = TickOutcome.ENTRY_FAILED;
			}
		}
		run.statistics = run.statistics.plus(breakdown, outcome);
		LOGGER.info(TickLogLineBuilder.buildTickLine(tickLog(run, minutesLeft, snapshot, indicators, breakdown,
				askStale, threshold, gateResult, outcome)));
		return outcome;
	}

	private TickOutcome manageOpenPosition(WindowRun run, BigDecimal bid, double price, Instant now) {
		PositionStateMachine machine = run.machine;
		Double bidValue = bid == null ? null : bid.doubleValue();
		Optional<ExitReason> trigger = machine.exitTrigger(bidValue, price);
		if (trigger.isEmpty()) {
			LOGGER.debug("EVENT=HOLDING window={} price={} bid={}", run.window.id(), price, bidValue);
			return TickOutcome.HOLDING;
		}
		Position position = machine.position().orElseThrow();
		LOGGER.info("EVENT=EXIT_TRIGGER window={} reason={} direction={} entryPrice={} bid={} price={} strike={}",
				run.window.id(), trigger.get(), position.direction(), position.entryPrice().toPlainString(),
				bidValue, price, run.window.strikePrice());
		CloseOutcome close = machine.close(trigger.get(), bid, now);
		return close.closed() ? TickOutcome.CLOSED : TickOutcome.CLOSE_FAILED;
	}

	private void announceOutside(WindowRun run, double minutesLeft) {
		if (tradeWindow.isPast(minutesLeft) && !run.announcedClosed) {
			run.announcedClosed = true;
			LOGGER.info("EVENT=TRADE_WINDOW_CLOSED window={} result=NO_SIGNAL evaluations={} blocked={}",
					run.window.id(), run.statistics.evaluations(), run.statistics.blocked());
		}
	}

	private WindowOutcome resolve(WindowRun run) {
		Optional<Double> finalPrice;
		try {
			finalPrice = fetcher.fetchReferencePrice();
		} catch (RuntimeException ex) {
			LOGGER.warn("EVENT=FINAL_PRICE_UNAVAILABLE window={} message={}", run.window.id(), ex.getMessage());
			finalPrice = Optional.empty();
		}
		Settlement settlement = run.machine.settle(finalPrice.orElse(null));
		WindowReport report = WindowReport.of(run.window, run.statistics, settlement,
				run.machine.failedEntries(), clock.instant());
		LOGGER.info(TickLogLineBuilder.buildWindowLine(report));
		reportSink.append(report);
		return new WindowOutcome(settlement, run.statistics, report);
	}

	private TickLog tickLog(WindowRun run, double minutesLeft, TickSnapshot snapshot, IndicatorSet indicators,
			ScoreBreakdown breakdown, boolean askStale, int threshold, GateResult gateResult, TickOutcome outcome) {
		return new TickLog(
				run.window.id(),
				minutesLeft,
				run.lastReference,
				snapshot.reference().map(quote -> quote.source()).orElse(null),
				run.window.strikePrice(),
				breakdown.direction(),
				indicators.upper(),
				indicators.middle(),
				indicators.lower(),
				indicators.atr(),
				indicators.rsi(),
				breakdown.bandPosition(),
				breakdown.maxMove(),
				breakdown.distance(),
				breakdown.depthRatio(),
				breakdown.contractPrice(),
				askStale,
				breakdown.bandScore(),
				breakdown.barrierScore(),
				breakdown.depthScore(),
				breakdown.valueScore(),
				breakdown.rawTotal(),
				breakdown.total(),
				threshold,
				breakdown.killSwitch(),
				breakdown.insufficientData(),
				gateResult.failed(),
				run.machine.state(),
				outcome);
	}

	WindowRun newRun(MarketWindow window) {
		return new WindowRun(window, machineFactory.apply(window));
	}

	/**
	 * Everything that lives exactly as long as one window.
	 */
	static final class WindowRun {

		private final MarketWindow window;
		private final PositionStateMachine machine;
		private final LastKnown<Double> referencePrice = LastKnown.skipTick("referencePrice");
		private final LastKnown<BigDecimal> upAsk = LastKnown.reuseLast("upAsk");
		private final LastKnown<BigDecimal> downAsk = LastKnown.reuseLast("downAsk");
		private final LastKnown<BigDecimal> upBid = LastKnown.reuseLast("upBid");
		private final LastKnown<BigDecimal> downBid = LastKnown.reuseLast("downBid");
		private final LastKnown<OrderBookDepthResponse> depth = LastKnown.treatAsZero("depth", EMPTY_DEPTH);
		private WindowStatistics statistics = WindowStatistics.EMPTY;
		private Double lastReference;
		private boolean announcedOpen;
		private boolean announcedEnding;
		private boolean announcedClosed;

		WindowRun(MarketWindow window, PositionStateMachine machine) {
			this.window = window;
			this.machine = machine;
		}

		PositionStateMachine machine() {
			return machine;
		}

		WindowStatistics statistics() {
			return statistics;
		}
	}
}
