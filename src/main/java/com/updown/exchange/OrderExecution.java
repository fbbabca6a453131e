package com.updown.exchange;

import java.math.BigDecimal;

import com.updown.exchange.dto.OrderResult;

import reactor.core.publisher.Mono;

/**
 * Order placement port. Implementations signal {@link OrderRejectedException} for
 * application-level refusals and {@link TransientVenueException} for timeout-class failures.
 */
public interface OrderExecution {

	Mono<OrderResult> placeOrder(String contractId, OrderSide side, BigDecimal price, BigDecimal size);

	/**
	 * Ground truth for close sizing: the tradable balance currently held for the contract.
	 */
	Mono<BigDecimal> currentHoldings(String contractId);
}
