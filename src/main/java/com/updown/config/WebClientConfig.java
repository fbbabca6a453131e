package com.updown.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.unit.DataSize;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;

import io.netty.channel.ChannelOption;
import reactor.netty.http.client.HttpClient;
import java.time.Duration;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

@Configuration
@EnableConfigurationProperties(VenueProperties.class)
public class WebClientConfig {

	private static final String USER_AGENT = "Mozilla/5.0 (compatible; updown-engine)";

	@Bean
	public WebClient.Builder webClientBuilder() {
		return WebClient.builder();
	}

	@Bean
	public WebClient gammaWebClient(VenueProperties properties, WebClient.Builder builder, DataSize maxInMemorySize) {
		return build(properties.gammaBaseUrl(), properties, builder, maxInMemorySize);
	}

	@Bean
	public WebClient clobWebClient(VenueProperties properties, WebClient.Builder builder, DataSize maxInMemorySize) {
		return build(properties.clobBaseUrl(), properties, builder, maxInMemorySize);
	}

	@Bean
	public WebClient binanceWebClient(VenueProperties properties, WebClient.Builder builder, DataSize maxInMemorySize) {
		return build(properties.binanceBaseUrl(), properties, builder, maxInMemorySize);
	}

	@Bean
	public WebClient coinbaseWebClient(VenueProperties properties, WebClient.Builder builder, DataSize maxInMemorySize) {
		return build(properties.coinbaseBaseUrl(), properties, builder, maxInMemorySize);
	}

	@Bean
	public WebClient krakenWebClient(VenueProperties properties, WebClient.Builder builder, DataSize maxInMemorySize) {
		return build(properties.krakenBaseUrl(), properties, builder, maxInMemorySize);
	}

	ExchangeStrategies exchangeStrategies(DataSize maxInMemorySize) {
		return ExchangeStrategies.builder()
				.codecs(configurer -> configurer.defaultCodecs()
						.maxInMemorySize((int) maxInMemorySize.toBytes()))
				.build();
	}

	@Bean
	public DataSize maxInMemorySize(@Value("${spring.codec.max-in-memory-size:5MB}") DataSize maxInMemorySize) {
		return maxInMemorySize;
	}

	@Bean
	public ObjectMapper objectMapper() {
		return new ObjectMapper().findAndRegisterModules()
				.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
				.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
	}

	private WebClient build(String baseUrl, VenueProperties properties, WebClient.Builder builder,
			DataSize maxInMemorySize) {
		ReactorClientHttpConnector connector = new ReactorClientHttpConnector(configureHttpClient(properties));
		return builder.clone()
				.baseUrl(baseUrl)
				.defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
				.defaultHeader(HttpHeaders.USER_AGENT, USER_AGENT)
				.clientConnector(connector)
				.exchangeStrategies(exchangeStrategies(maxInMemorySize))
				.build();
	}

	private HttpClient configureHttpClient(VenueProperties properties) {
		int connectTimeout = properties.connectTimeoutMs() > 0 ? properties.connectTimeoutMs() : 5000;
		long responseTimeout = properties.responseTimeoutMs() > 0 ? properties.responseTimeoutMs() : 10000;
		long handshakeTimeout = properties.handshakeTimeoutMs() > 0 ? properties.handshakeTimeoutMs() : 10000;
		return HttpClient.create()
				.option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeout)
				.responseTimeout(Duration.ofMillis(responseTimeout))
				.secure(ssl -> ssl.handshakeTimeout(Duration.ofMillis(handshakeTimeout)));
	}
}
