package com.updown.market;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.updown.config.VenueProperties;

import reactor.core.publisher.Mono;

/**
 * Resolves the live window from the event listing. Window slugs end with the epoch second the
 * window opens at, so the current one is derived from the clock and looked up by slug.
 */
public class GammaMarketDirectory implements MarketDirectory {

	private static final Logger LOGGER = LoggerFactory.getLogger(GammaMarketDirectory.class);
	private static final Pattern DOLLAR_AMOUNT = Pattern.compile("\\$([0-9,]+(?:\\.[0-9]+)?)");
	private static final Pattern PLAIN_AMOUNT = Pattern.compile("([0-9][0-9,]*\\.[0-9]{2})");

	private final WebClient gammaWebClient;
	private final VenueProperties properties;
	private final ObjectMapper objectMapper;
	private final Clock clock;

	public GammaMarketDirectory(WebClient gammaWebClient, VenueProperties properties, ObjectMapper objectMapper,
			Clock clock) {
		this.gammaWebClient = gammaWebClient;
		this.properties = properties;
		this.objectMapper = objectMapper;
		this.clock = clock;
	}

	@Override
	public Mono<MarketWindow> findActiveWindow() {
		Instant openTime = currentWindowOpen(clock.instant(), properties.windowLength());
		String slug = properties.slugPrefix() + openTime.getEpochSecond();
		return gammaWebClient
				.get()
				.uri(uriBuilder -> uriBuilder
						.path("/events")
						.queryParam("slug", slug)
						.build())
				.retrieve()
				.bodyToMono(JsonNode.class)
				.flatMap(node -> Mono.justOrEmpty(firstEvent(node)))
				.flatMap(event -> Mono.justOrEmpty(toWindow(slug, openTime, event)))
				.doOnError(error -> LOGGER.warn("EVENT=DISCOVERY_FAILED slug={} error={}", slug, error.getMessage()))
				.onErrorResume(error -> Mono.empty());
	}

	static Instant currentWindowOpen(Instant now, Duration windowLength) {
		long length = windowLength.getSeconds();
		long epoch = now.getEpochSecond();
		return Instant.ofEpochSecond(epoch - Math.floorMod(epoch, length));
	}

	MarketWindow toWindow(String slug, Instant openTime, JsonNode event) {
		List<String> tokenIds = contractIds(event.path("markets"));
		if (tokenIds.size() < 2) {
			LOGGER.warn("EVENT=DISCOVERY_NO_CONTRACTS slug={}", slug);
			return null;
		}
		OptionalDouble strike = strikePrice(event);
		if (strike.isEmpty()) {
			LOGGER.warn("EVENT=DISCOVERY_NO_STRIKE slug={}", slug);
			return null;
		}
		Instant closeTime = openTime.plus(properties.windowLength());
		return new MarketWindow(slug, strike.getAsDouble(), openTime, closeTime, tokenIds.get(0), tokenIds.get(1));
	}

	private static JsonNode firstEvent(JsonNode node) {
		if (node == null) {
			return null;
		}
		if (node.isArray()) {
			return node.size() > 0 ? node.get(0) : null;
		}
		return node.isObject() ? node : null;
	}

	private List<String> contractIds(JsonNode markets) {
		for (JsonNode market : markets) {
			JsonNode ids = market.get("clobTokenIds");
			if (ids == null || ids.isNull()) {
				continue;
			}
			try {
				List<String> parsed = ids.isTextual()
						? objectMapper.readValue(ids.asText(), new TypeReference<List<String>>() {
						})
						: objectMapper.convertValue(ids, new TypeReference<List<String>>() {
						});
				if (parsed.size() >= 2) {
					return parsed;
				}
			} catch (Exception ex) {
				LOGGER.warn("EVENT=DISCOVERY_BAD_TOKEN_IDS value={} error={}", ids, ex.getMessage());
			}
		}
		return List.of();
	}

	static OptionalDouble strikePrice(JsonNode event) {
		JsonNode priceToBeat = event.path("eventMetadata").path("priceToBeat");
		if (priceToBeat.isNumber() || priceToBeat.isTextual()) {
			double value = priceToBeat.asDouble(Double.NaN);
			if (Double.isFinite(value) && value > 0) {
				return OptionalDouble.of(value);
			}
		}
		OptionalDouble fromTitle = extractStrike(event.path("title").asText(""));
		if (fromTitle.isPresent()) {
			return fromTitle;
		}
		for (JsonNode market : event.path("markets")) {
			OptionalDouble fromQuestion = extractStrike(market.path("question").asText(""));
			if (fromQuestion.isPresent()) {
				return fromQuestion;
			}
		}
		return OptionalDouble.empty();
	}

	static OptionalDouble extractStrike(String text) {
		if (text == null || text.isBlank()) {
			return OptionalDouble.empty();
		}
		Matcher dollar = DOLLAR_AMOUNT.matcher(text);
		if (dollar.find()) {
			return parse(dollar.group(1));
		}
		Matcher plain = PLAIN_AMOUNT.matcher(text);
		if (plain.find()) {
			return parse(plain.group(1));
		}
		return OptionalDouble.empty();
	}

	private static OptionalDouble parse(String raw) {
		try {
			double value = Double.parseDouble(raw.replace(",", ""));
			return value > 0 ? OptionalDouble.of(value) : OptionalDouble.empty();
		} catch (NumberFormatException ex) {
			return OptionalDouble.empty();
		}
	}
}
