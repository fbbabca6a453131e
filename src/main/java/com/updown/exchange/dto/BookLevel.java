package com.updown.exchange.dto;

import java.math.BigDecimal;

public record BookLevel(BigDecimal price, BigDecimal size) {
}
