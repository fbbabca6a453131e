package com.updown.exchange;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import com.fasterxml.jackson.databind.JsonNode;
import com.updown.exchange.dto.BookLevel;
import com.updown.exchange.dto.ContractBook;

import reactor.core.publisher.Mono;

@Component
public class ClobBookClient implements ContractBookSource {

	private final WebClient clobWebClient;

	public ClobBookClient(@Qualifier("clobWebClient") WebClient clobWebClient) {
		this.clobWebClient = clobWebClient;
	}

	@Override
	public Mono<ContractBook> fetchBook(String contractId) {
		if (contractId == null || contractId.isBlank()) {
			return Mono.empty();
		}
		return clobWebClient
				.get()
				.uri(uriBuilder -> uriBuilder
						.path("/book")
						.queryParam("token_id", contractId)
						.build())
				.retrieve()
				.onStatus(status -> status.is5xxServerError() || status.value() == 429, response -> response
						.bodyToMono(String.class)
						.defaultIfEmpty("<empty>")
						.flatMap(body -> Mono.error(new TransientVenueException(response.statusCode().value(),
								"Book fetch failed: " + body))))
				.bodyToMono(JsonNode.class)
				.map(node -> parseBook(contractId, node));
	}

	static ContractBook parseBook(String contractId, JsonNode node) {
		BigDecimal minOrderSize = decimal(node.get("min_order_size"));
		return new ContractBook(contractId, parseLevels(node.get("bids")), parseLevels(node.get("asks")),
				minOrderSize);
	}

	private static List<BookLevel> parseLevels(JsonNode levels) {
		if (levels == null || !levels.isArray()) {
			return List.of();
		}
		List<BookLevel> parsed = new ArrayList<>();
		for (JsonNode level : levels) {
			BigDecimal price = decimal(level.get("price"));
			BigDecimal size = decimal(level.get("size"));
			if (price != null && size != null) {
				parsed.add(new BookLevel(price, size));
			}
		}
		return parsed;
	}

	private static BigDecimal decimal(JsonNode value) {
		if (value == null || value.isNull()) {
			return null;
		}
		try {
			return new BigDecimal(value.asText());
		} catch (NumberFormatException ex) {
			return null;
		}
	}
}
