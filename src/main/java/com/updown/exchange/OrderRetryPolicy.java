package com.updown.exchange;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

/**
 * Bounded exponential backoff applied to order placement and closing. Only timeout-class
 * failures are retried; rejections pass through untouched. When the budget is spent the last
 * failure is surfaced as an {@link OrderRejectedException} with code {@code RETRIES_EXHAUSTED}.
 */
public class OrderRetryPolicy {

	private static final Logger LOGGER = LoggerFactory.getLogger(OrderRetryPolicy.class);

	private final int maxRetries;
	private final Duration firstBackoff;
	private final Duration maxBackoff;
	private final Predicate<Throwable> retryable;

	public OrderRetryPolicy(int maxRetries, Duration firstBackoff, Duration maxBackoff) {
		this(maxRetries, firstBackoff, maxBackoff, OrderRetryPolicy::isTransient);
	}

	public OrderRetryPolicy(int maxRetries, Duration firstBackoff, Duration maxBackoff,
			Predicate<Throwable> retryable) {
		this.maxRetries = Math.max(0, maxRetries);
		this.firstBackoff = firstBackoff;
		this.maxBackoff = maxBackoff;
		this.retryable = retryable;
	}

	/**
	 * The source is resubscribed on every attempt, so it must be lazy ({@code Mono.defer}).
	 */
	public <T> Mono<T> apply(Mono<T> call, String operation) {
		return call.retryWhen(retrySpec(operation));
	}

	public int maxRetries() {
		return maxRetries;
	}

	RetryBackoffSpec retrySpec(String operation) {
		return Retry.backoff(maxRetries, firstBackoff)
				.maxBackoff(maxBackoff)
				.filter(retryable)
				.doBeforeRetry(signal -> LOGGER.warn("EVENT=ORDER_RETRY operation={} attempt={} error={}",
						operation, signal.totalRetries() + 1, signal.failure().getMessage()))
				.onRetryExhaustedThrow((spec, signal) -> new OrderRejectedException("RETRIES_EXHAUSTED",
						operation + " failed after " + signal.totalRetries() + " retries: "
								+ signal.failure().getMessage()));
	}

	public static boolean isTransient(Throwable error) {
		if (error instanceof OrderRejectedException) {
			return false;
		}
		if (error instanceof TransientVenueException
				|| error instanceof TimeoutException
				|| error instanceof IOException
				|| error instanceof WebClientRequestException) {
			return true;
		}
		if (error instanceof WebClientResponseException responseException) {
			int status = responseException.getStatusCode().value();
			return status == 429 || status >= 500;
		}
		return false;
	}
}
