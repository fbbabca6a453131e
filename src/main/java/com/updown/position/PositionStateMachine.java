package com.updown.position;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.updown.exchange.OrderExecution;
import com.updown.exchange.OrderRetryPolicy;
import com.updown.exchange.OrderSide;
import com.updown.exchange.VenueApiException;
import com.updown.exchange.dto.OrderResult;
import com.updown.market.MarketWindow;
import com.updown.strategy.Direction;

import reactor.core.publisher.Mono;

/**
 * Lifecycle of the one position a window may hold. A fresh instance is created per window and
 * driven from the window loop thread only, so order calls block here until they resolve.
 */
public class PositionStateMachine {

	private static final Logger LOGGER = LoggerFactory.getLogger(PositionStateMachine.class);

	private static final BigDecimal WIN_PAYOUT = BigDecimal.ONE;
	private static final BigDecimal LOSS_PAYOUT = BigDecimal.ZERO;

	private final MarketWindow window;
	private final OrderExecution execution;
	private final OrderRetryPolicy retryPolicy;
	private final EntrySizing sizing;
	private final ExitRules exitRules;
	private final Duration orderTimeout;

	private PositionState state = PositionState.FLAT;
	private Position position;
	private int failedEntries;
	private Settlement settlement;

	public PositionStateMachine(MarketWindow window, OrderExecution execution, OrderRetryPolicy retryPolicy,
			EntrySizing sizing, ExitRules exitRules, Duration orderTimeout) {
		this.window = window;
		this.execution = execution;
		this.retryPolicy = retryPolicy;
		this.sizing = sizing;
		this.exitRules = exitRules;
		this.orderTimeout = orderTimeout;
	}

	public PositionState state() {
		return state;
	}

	public Optional<Position> position() {
		return Optional.ofNullable(position);
	}

	public int failedEntries() {
		return failedEntries;
	}

	public boolean canEnter() {
		return state == PositionState.FLAT;
	}

	public boolean isOpen() {
		return state == PositionState.OPEN;
	}

	public EntryOutcome enter(Direction direction, BigDecimal ask, BigDecimal venueMinimum, Instant now) {
		if (!canEnter()) {
			throw new IllegalStateException("entry not allowed in state " + state + " for window " + window.id());
		}
		if (ask == null || ask.signum() <= 0) {
			failedEntries++;
			LOGGER.warn("EVENT=ENTRY_FAILED window={} reason=NO_ASK", window.id());
			return EntryOutcome.rejected("NO_ASK");
		}
		String contractId = direction == Direction.UP ? window.upContractId() : window.downContractId();
		BigDecimal size = sizing.sizeFor(ask, venueMinimum);
		state = PositionState.PENDING_ENTRY;
		LOGGER.info("EVENT=ENTRY_SUBMIT window={} direction={} contract={} price={} size={}", window.id(), direction,
				contractId, ask.toPlainString(), size.toPlainString());
		OrderAttempt attempt = submit(contractId, OrderSide.BUY, ask, size, "entry");
		if (attempt.result() == null || !attempt.result().hasFill()) {
			state = PositionState.FLAT;
			failedEntries++;
			LOGGER.warn("EVENT=ENTRY_FAILED window={} direction={} reason={}", window.id(), direction,
					attempt.reason());
			return EntryOutcome.rejected(attempt.reason());
		}
		OrderResult fill = attempt.result();
		position = Position.opened(contractId, direction, fill.fillPrice(), fill.filledSize(), fill.orderId(), now);
		state = PositionState.OPEN;
		LOGGER.info("EVENT=ENTRY_FILLED window={} direction={} orderId={} price={} size={}", window.id(), direction,
				fill.orderId(), fill.fillPrice().toPlainString(), fill.filledSize().toPlainString());
		return EntryOutcome.filled(position);
	}

	public Optional<ExitReason> exitTrigger(Double bestBid, double referencePrice) {
		if (state != PositionState.OPEN) {
			return Optional.empty();
		}
		return ExitEvaluator.evaluate(position, exitRules, bestBid, referencePrice, window.strikePrice());
	}

	/**
	 * Sells the current holdings at {@code bid}. On failure the position stays open with one more
	 * close attempt recorded, so the trigger is re-evaluated on the next tick.
	 */
	public CloseOutcome close(ExitReason reason, BigDecimal bid, Instant now) {
		if (state != PositionState.OPEN) {
			throw new IllegalStateException("close not allowed in state " + state + " for window " + window.id());
		}
		if (bid == null || bid.signum() <= 0) {
			return closeFailed(reason, "NO_BID");
		}
		state = PositionState.PENDING_CLOSE;
		BigDecimal size = closeSize();
		LOGGER.info("EVENT=CLOSE_SUBMIT window={} reason={} contract={} price={} size={} attempt={}", window.id(),
				reason, position.contractId(), bid.toPlainString(), size.toPlainString(),
				position.closeAttempts() + 1);
		OrderAttempt attempt = submit(position.contractId(), OrderSide.SELL, bid, size, "close");
		if (attempt.result() == null || !attempt.result().hasFill()) {
			return closeFailed(reason, attempt.reason());
		}
		OrderResult fill = attempt.result();
		position = position.withClose(reason, fill.fillPrice(), fill.filledSize(), now);
		state = PositionState.CLOSED;
		LOGGER.info("EVENT=CLOSE_FILLED window={} reason={} orderId={} price={} size={}", window.id(), reason,
				fill.orderId(), fill.fillPrice().toPlainString(), fill.filledSize().toPlainString());
		return new CloseOutcome(true, position, null);
	}

	/**
	 * Final transition of the window. An open position is settled at {@code finalPrice} by the
	 * binary payout; without a final price it stays {@link WindowResult#UNRESOLVED}.
	 */
	public Settlement settle(Double finalPrice) {
		if (settlement != null) {
			return settlement;
		}
		if (position == null) {
			settlement = new Settlement(WindowResult.NO_SIGNAL, null, finalPrice, null, null, null, null);
		} else if (position.closed()) {
			BigDecimal pnl = position.closedSize().multiply(position.closePrice().subtract(position.entryPrice()));
			settlement = settled(WindowResult.CLOSED, finalPrice, position.closePrice(), pnl);
		} else if (finalPrice == null) {
			settlement = new Settlement(WindowResult.UNRESOLVED, position, null, null, null, null, position.stake());
		} else {
			boolean won = position.direction().winsAt(finalPrice, window.strikePrice());
			BigDecimal payout = won ? WIN_PAYOUT : LOSS_PAYOUT;
			BigDecimal pnl = position.size().multiply(payout.subtract(position.entryPrice()));
			settlement = settled(won ? WindowResult.WIN : WindowResult.LOSS, finalPrice, payout, pnl);
		}
		state = PositionState.CLOSED;
		return settlement;
	}

	private Settlement settled(WindowResult result, Double finalPrice, BigDecimal exitPrice, BigDecimal pnl) {
		BigDecimal stake = position.stake();
		Double pnlPct = stake.signum() > 0
				? pnl.divide(stake, 6, RoundingMode.HALF_UP).doubleValue() * 100.0
				: null;
		return new Settlement(result, position, finalPrice, exitPrice, pnl, pnlPct, stake);
	}

	private CloseOutcome closeFailed(ExitReason reason, String failure) {
		position = position.withFailedClose();
		state = PositionState.OPEN;
		LOGGER.warn("EVENT=CLOSE_FAILED window={} reason={} attempts={} failure={}", window.id(), reason,
				position.closeAttempts(), failure);
		return new CloseOutcome(false, position, failure);
	}

	/**
	 * Exact held balance truncated down, so partial entry fills never cause a balance-exceeded
	 * rejection. Falls back to the recorded size when the balance cannot be read.
	 */
	BigDecimal closeSize() {
		BigDecimal held;
		try {
			held = execution.currentHoldings(position.contractId()).block(orderTimeout);
		} catch (RuntimeException ex) {
			LOGGER.warn("EVENT=HOLDINGS_UNAVAILABLE window={} contract={} error={}", window.id(),
					position.contractId(), ex.getMessage());
			held = null;
		}
		if (held == null || held.signum() <= 0) {
			return EntrySizing.truncate(position.size());
		}
		return EntrySizing.truncate(held);
	}

	private OrderAttempt submit(String contractId, OrderSide side, BigDecimal price, BigDecimal size,
			String operation) {
		try {
			OrderResult result = retryPolicy
					.apply(Mono.defer(() -> execution.placeOrder(contractId, side, price, size)), operation)
					.block(orderTimeout);
			if (result == null) {
				return new OrderAttempt(null, "NO_RESPONSE");
			}
			return new OrderAttempt(result, result.rejectReason() != null ? result.rejectReason() : "NO_FILL");
		} catch (VenueApiException ex) {
			return new OrderAttempt(null, ex.code() + ": " + ex.getMessage());
		} catch (RuntimeException ex) {
			return new OrderAttempt(null, ex.getClass().getSimpleName() + ": " + ex.getMessage());
		}
	}

	private record OrderAttempt(OrderResult result, String reason) {
	}
}
