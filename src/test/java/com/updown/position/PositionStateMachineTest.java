package com.updown.position;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import com.updown.exchange.OrderExecution;
import com.updown.exchange.OrderRejectedException;
import com.updown.exchange.OrderRetryPolicy;
import com.updown.exchange.OrderSide;
import com.updown.exchange.TransientVenueException;
import com.updown.exchange.dto.OrderResult;
import com.updown.market.MarketWindow;
import com.updown.strategy.Direction;

import reactor.core.publisher.Mono;

class PositionStateMachineTest {

	private static final Instant OPEN = Instant.parse("2024-05-01T12:00:00Z");
	private static final Instant NOW = OPEN.plusSeconds(300);

	private final MarketWindow window = new MarketWindow("btc-updown-15m-1714564800", 100_000.0, OPEN,
			OPEN.plusSeconds(900), "up-token", "down-token");

	private OrderExecution execution;
	private PositionStateMachine machine;

	@BeforeEach
	void setUp() {
		execution = mock(OrderExecution.class);
		machine = new PositionStateMachine(window, execution,
				new OrderRetryPolicy(2, Duration.ofMillis(1), Duration.ofMillis(2)),
				new EntrySizing(BigDecimal.ONE, new BigDecimal("1.05")), ExitRules.defaults(), Duration.ofSeconds(5));
	}

	@Test
	void entryTakesPriceAndSizeFromTheFill() {
		when(execution.placeOrder(eq("up-token"), eq(OrderSide.BUY), any(), any()))
				.thenReturn(Mono.just(OrderResult.filled("o-1", new BigDecimal("1.4"), new BigDecimal("0.70"))));

		EntryOutcome outcome = machine.enter(Direction.UP, new BigDecimal("0.72"), null, NOW);

		assertThat(outcome.filled()).isTrue();
		assertThat(machine.state()).isEqualTo(PositionState.OPEN);
		Position position = machine.position().orElseThrow();
		assertThat(position.entryPrice()).isEqualByComparingTo("0.70");
		assertThat(position.size()).isEqualByComparingTo("1.4");
		assertThat(position.contractId()).isEqualTo("up-token");
	}

	@Test
	void entrySizeCoversMinimumOrderValue() {
		when(execution.placeOrder(any(), any(), any(), any()))
				.thenReturn(Mono.just(OrderResult.filled("o-1", new BigDecimal("1.5"), new BigDecimal("0.70"))));

		machine.enter(Direction.DOWN, new BigDecimal("0.70"), null, NOW);

		ArgumentCaptor<BigDecimal> size = ArgumentCaptor.forClass(BigDecimal.class);
		verify(execution).placeOrder(eq("down-token"), eq(OrderSide.BUY), eq(new BigDecimal("0.70")), size.capture());
		assertThat(size.getValue()).isEqualByComparingTo("1.5");
	}

	@Test
	void onlyOneEntryPerWindow() {
		when(execution.placeOrder(any(), any(), any(), any()))
				.thenReturn(Mono.just(OrderResult.filled("o-1", BigDecimal.ONE, new BigDecimal("0.70"))));
		machine.enter(Direction.UP, new BigDecimal("0.70"), null, NOW);

		assertThat(machine.canEnter()).isFalse();
		assertThatThrownBy(() -> machine.enter(Direction.UP, new BigDecimal("0.70"), null, NOW))
				.isInstanceOf(IllegalStateException.class);
		verify(execution, times(1)).placeOrder(any(), any(), any(), any());
	}

	@Test
	void rejectedEntryReturnsToFlatWithoutRetrying() {
		when(execution.placeOrder(any(), any(), any(), any()))
				.thenReturn(Mono.error(new OrderRejectedException("INSUFFICIENT_BALANCE", "not enough balance")));

		EntryOutcome outcome = machine.enter(Direction.UP, new BigDecimal("0.70"), null, NOW);

		assertThat(outcome.filled()).isFalse();
		assertThat(outcome.rejectReason()).startsWith("INSUFFICIENT_BALANCE");
		assertThat(machine.state()).isEqualTo(PositionState.FLAT);
		assertThat(machine.canEnter()).isTrue();
		assertThat(machine.failedEntries()).isEqualTo(1);
		verify(execution, times(1)).placeOrder(any(), any(), any(), any());
	}

	@Test
	void transientEntryFailureIsRetried() {
		when(execution.placeOrder(any(), any(), any(), any()))
				.thenReturn(Mono.error(new TransientVenueException("read timeout")))
				.thenReturn(Mono.just(OrderResult.filled("o-2", BigDecimal.ONE, new BigDecimal("0.66"))));

		EntryOutcome outcome = machine.enter(Direction.UP, new BigDecimal("0.66"), null, NOW);

		assertThat(outcome.filled()).isTrue();
		verify(execution, times(2)).placeOrder(any(), any(), any(), any());
	}

	@Test
	void failedCloseKeepsPositionOpenAndCountsEachAttempt() {
		open(new BigDecimal("1.5"), new BigDecimal("0.70"));
		when(execution.currentHoldings("up-token")).thenReturn(Mono.just(new BigDecimal("1.5")));
		when(execution.placeOrder(eq("up-token"), eq(OrderSide.SELL), any(), any()))
				.thenReturn(Mono.error(new OrderRejectedException("NOT_MATCHED", "no bid")))
				.thenReturn(Mono.error(new OrderRejectedException("NOT_MATCHED", "no bid")))
				.thenReturn(Mono.just(OrderResult.filled("c-1", new BigDecimal("1.5"), new BigDecimal("0.40"))));

		CloseOutcome first = machine.close(ExitReason.STOP_LOSS, new BigDecimal("0.40"), NOW);
		assertThat(first.closed()).isFalse();
		assertThat(first.position().closed()).isFalse();
		assertThat(first.position().closeAttempts()).isEqualTo(1);
		assertThat(machine.state()).isEqualTo(PositionState.OPEN);

		CloseOutcome second = machine.close(ExitReason.STOP_LOSS, new BigDecimal("0.40"), NOW);
		assertThat(second.position().closeAttempts()).isEqualTo(2);

		CloseOutcome third = machine.close(ExitReason.STOP_LOSS, new BigDecimal("0.40"), NOW);
		assertThat(third.closed()).isTrue();
		assertThat(third.position().closed()).isTrue();
		assertThat(third.position().closeReason()).isEqualTo(ExitReason.STOP_LOSS);
		assertThat(machine.state()).isEqualTo(PositionState.CLOSED);
		assertThatThrownBy(() -> machine.close(ExitReason.STOP_LOSS, new BigDecimal("0.40"), NOW))
				.isInstanceOf(IllegalStateException.class);
	}

	@Test
	void closeWithoutBidCountsAsFailedAttempt() {
		open(BigDecimal.ONE, new BigDecimal("0.70"));

		CloseOutcome outcome = machine.close(ExitReason.STRIKE_BARRIER, null, NOW);

		assertThat(outcome.closed()).isFalse();
		assertThat(outcome.failureReason()).isEqualTo("NO_BID");
		assertThat(outcome.position().closeAttempts()).isEqualTo(1);
		verify(execution, never()).placeOrder(any(), eq(OrderSide.SELL), any(), any());
	}

	@Test
	void closeSellsHeldBalanceTruncatedDown() {
		open(new BigDecimal("1.5"), new BigDecimal("0.70"));
		when(execution.currentHoldings("up-token")).thenReturn(Mono.just(new BigDecimal("1.49999")));

		assertThat(machine.closeSize()).isEqualByComparingTo("1.4999");
	}

	@Test
	void closeFallsBackToRecordedSizeWhenBalanceUnreadable() {
		open(new BigDecimal("1.5"), new BigDecimal("0.70"));
		when(execution.currentHoldings("up-token")).thenReturn(Mono.error(new TransientVenueException("down")));

		assertThat(machine.closeSize()).isEqualByComparingTo("1.5");
	}

	@Test
	void expiryWithoutPositionIsNoSignal() {
		Settlement settlement = machine.settle(100_500.0);

		assertThat(settlement.result()).isEqualTo(WindowResult.NO_SIGNAL);
		assertThat(settlement.hadPosition()).isFalse();
		assertThat(machine.state()).isEqualTo(PositionState.CLOSED);
	}

	@Test
	void openPositionSettlesByBinaryPayout() {
		open(new BigDecimal("1.5"), new BigDecimal("0.70"));

		Settlement settlement = machine.settle(100_100.0);

		assertThat(settlement.result()).isEqualTo(WindowResult.WIN);
		assertThat(settlement.exitPrice()).isEqualByComparingTo("1");
		assertThat(settlement.pnl()).isEqualByComparingTo("0.45");
		assertThat(settlement.stake()).isEqualByComparingTo("1.05");
	}

	@Test
	void openPositionLosesStakeWhenFinalPriceIsOnTheWrongSide() {
		open(new BigDecimal("1.5"), new BigDecimal("0.70"));

		Settlement settlement = machine.settle(100_000.0);

		assertThat(settlement.result()).isEqualTo(WindowResult.LOSS);
		assertThat(settlement.pnl()).isEqualByComparingTo("-1.05");
		assertThat(settlement.pnlPct()).isEqualTo(-100.0);
	}

	@Test
	void missingFinalPriceLeavesPositionUnresolved() {
		open(BigDecimal.ONE, new BigDecimal("0.70"));

		Settlement settlement = machine.settle(null);

		assertThat(settlement.result()).isEqualTo(WindowResult.UNRESOLVED);
		assertThat(settlement.pnl()).isNull();
	}

	@Test
	void closedPositionReportsRealizedPnl() {
		open(new BigDecimal("2"), new BigDecimal("0.60"));
		when(execution.currentHoldings("up-token")).thenReturn(Mono.just(new BigDecimal("2")));
		when(execution.placeOrder(eq("up-token"), eq(OrderSide.SELL), any(), any()))
				.thenReturn(Mono.just(OrderResult.filled("c-1", new BigDecimal("2"), new BigDecimal("0.98"))));
		machine.close(ExitReason.TAKE_PROFIT, new BigDecimal("0.98"), NOW);

		Settlement settlement = machine.settle(99_000.0);

		assertThat(settlement.result()).isEqualTo(WindowResult.CLOSED);
		assertThat(settlement.pnl()).isEqualByComparingTo("0.76");
		assertThat(machine.settle(101_000.0)).isSameAs(settlement);
	}

	private void open(BigDecimal size, BigDecimal price) {
		when(execution.placeOrder(eq("up-token"), eq(OrderSide.BUY), any(), any()))
				.thenReturn(Mono.just(OrderResult.filled("o-1", size, price)));
		machine.enter(Direction.UP, price, null, NOW);
		assertThat(machine.isOpen()).isTrue();
	}
}
