package com.updown.exchange;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

class OrderRetryPolicyTest {

	private final OrderRetryPolicy policy = new OrderRetryPolicy(3, Duration.ofMillis(1), Duration.ofMillis(5));

	@Test
	void retriesTransientFailuresUntilSuccess() {
		AtomicInteger attempts = new AtomicInteger();
		Mono<String> call = Mono.defer(() -> attempts.incrementAndGet() < 3
				? Mono.error(new TransientVenueException("read timeout"))
				: Mono.just("filled"));

		StepVerifier.create(policy.apply(call, "entry"))
				.expectNext("filled")
				.verifyComplete();
		assertThat(attempts).hasValue(3);
	}

	@Test
	void rejectionsAreNotRetried() {
		AtomicInteger attempts = new AtomicInteger();
		Mono<String> call = Mono.defer(() -> {
			attempts.incrementAndGet();
			return Mono.error(new OrderRejectedException("INSUFFICIENT_BALANCE", "not enough balance"));
		});

		StepVerifier.create(policy.apply(call, "entry"))
				.expectErrorMatches(error -> error instanceof OrderRejectedException rejected
						&& "INSUFFICIENT_BALANCE".equals(rejected.code()))
				.verify();
		assertThat(attempts).hasValue(1);
	}

	@Test
	void exhaustedRetriesSurfaceAsRejection() {
		AtomicInteger attempts = new AtomicInteger();
		Mono<String> call = Mono.defer(() -> {
			attempts.incrementAndGet();
			return Mono.error(new TransientVenueException("connection reset"));
		});

		StepVerifier.create(policy.apply(call, "close"))
				.expectErrorMatches(error -> error instanceof OrderRejectedException rejected
						&& "RETRIES_EXHAUSTED".equals(rejected.code()))
				.verify();
		assertThat(attempts).hasValue(4);
	}

	@Test
	void classifiesTimeoutClassErrors() {
		assertThat(OrderRetryPolicy.isTransient(new TimeoutException())).isTrue();
		assertThat(OrderRetryPolicy.isTransient(new IOException("reset"))).isTrue();
		assertThat(OrderRetryPolicy.isTransient(WebClientResponseException.create(503, "Service Unavailable",
				HttpHeaders.EMPTY, new byte[0], null))).isTrue();
		assertThat(OrderRetryPolicy.isTransient(WebClientResponseException.create(429, "Too Many Requests",
				HttpHeaders.EMPTY, new byte[0], null))).isTrue();
		assertThat(OrderRetryPolicy.isTransient(WebClientResponseException.create(400, "Bad Request",
				HttpHeaders.EMPTY, new byte[0], null))).isFalse();
		assertThat(OrderRetryPolicy.isTransient(new IllegalArgumentException("bug"))).isFalse();
	}
}
