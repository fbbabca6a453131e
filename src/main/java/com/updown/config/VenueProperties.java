package com.updown.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

@Validated
@ConfigurationProperties(prefix = "venue")
public record VenueProperties(
		@NotBlank String gammaBaseUrl,
		@NotBlank String clobBaseUrl,
		@NotBlank String binanceBaseUrl,
		@NotBlank String coinbaseBaseUrl,
		@NotBlank String krakenBaseUrl,
		@NotBlank String referenceSymbol,
		@NotBlank String coinbaseProduct,
		@NotBlank String krakenPair,
		@NotBlank String slugPrefix,
		@NotNull Duration windowLength,
		int referenceDepthLimit,
		int connectTimeoutMs,
		long responseTimeoutMs,
		long handshakeTimeoutMs) {
}
