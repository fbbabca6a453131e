package com.updown.exchange;

import java.math.BigDecimal;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.updown.exchange.dto.ContractBook;
import com.updown.exchange.dto.OrderResult;

import reactor.core.publisher.Mono;

/**
 * Fills orders against the live contract book without sending anything to the venue.
 * A BUY fills at the best ask when the limit reaches it, a SELL at the best bid; holdings are
 * kept in memory per contract and a contract is forgotten once its balance is sold down to zero.
 */
public class PaperOrderExecution implements OrderExecution {

	private static final Logger LOGGER = LoggerFactory.getLogger(PaperOrderExecution.class);

	private final ContractBookSource bookSource;
	private final Map<String, BigDecimal> holdings = new ConcurrentHashMap<>();
	private final AtomicLong sequence = new AtomicLong(0L);

	public PaperOrderExecution(ContractBookSource bookSource) {
		this.bookSource = bookSource;
	}

	@Override
	public Mono<OrderResult> placeOrder(String contractId, OrderSide side, BigDecimal price, BigDecimal size) {
		if (size == null || size.signum() <= 0) {
			return Mono.error(new OrderRejectedException("INVALID_SIZE", "Order size must be positive"));
		}
		return bookSource.fetchBook(contractId)
				.switchIfEmpty(Mono.error(new TransientVenueException("No book for contract " + contractId)))
				.flatMap(book -> fill(book, side, price, size));
	}

	@Override
	public Mono<BigDecimal> currentHoldings(String contractId) {
		return Mono.just(holdings.getOrDefault(contractId, BigDecimal.ZERO));
	}

	int trackedContracts() {
		return holdings.size();
	}

	private Mono<OrderResult> fill(ContractBook book, OrderSide side, BigDecimal price, BigDecimal size) {
		String contractId = book.contractId();
		if (book.minOrderSize() != null && size.compareTo(book.minOrderSize()) < 0) {
			return Mono.error(new OrderRejectedException("SIZE_BELOW_MINIMUM",
					"Size " + size.toPlainString() + " below venue minimum " + book.minOrderSize().toPlainString()));
		}
		if (side == OrderSide.BUY) {
			BigDecimal ask = book.bestAsk().orElse(null);
			if (ask == null || ask.compareTo(price) > 0) {
				return Mono.error(new OrderRejectedException("NOT_MATCHED",
						"Buy limit " + price.toPlainString() + " does not reach ask " + ask));
			}
			holdings.merge(contractId, size, BigDecimal::add);
			return Mono.just(record(side, contractId, size, ask));
		}
		BigDecimal held = holdings.getOrDefault(contractId, BigDecimal.ZERO);
		if (size.compareTo(held) > 0) {
			return Mono.error(new OrderRejectedException("INSUFFICIENT_BALANCE",
					"Sell size " + size.toPlainString() + " exceeds balance " + held.toPlainString()));
		}
		BigDecimal bid = book.bestBid().orElse(null);
		if (bid == null || bid.compareTo(price) < 0) {
			return Mono.error(new OrderRejectedException("NOT_MATCHED",
					"Sell limit " + price.toPlainString() + " above bid " + bid));
		}
		BigDecimal remaining = held.subtract(size);
		if (remaining.signum() == 0) {
			holdings.remove(contractId);
		} else {
			holdings.put(contractId, remaining);
		}
		return Mono.just(record(side, contractId, size, bid));
	}

	private OrderResult record(OrderSide side, String contractId, BigDecimal size, BigDecimal fillPrice) {
		String orderId = "paper-" + sequence.incrementAndGet();
		LOGGER.info("EVENT=PAPER_FILL orderId={} side={} contract={} size={} price={}", orderId, side, contractId,
				size.toPlainString(), fillPrice.toPlainString());
		return OrderResult.filled(orderId, size, fillPrice);
	}
}
