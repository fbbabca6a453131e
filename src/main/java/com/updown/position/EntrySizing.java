package com.updown.position;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Order size for an entry: the configured share count, raised to whatever the venue's minimum
 * order value and minimum size require, truncated to {@link #SIZE_SCALE} decimals.
 */
public record EntrySizing(BigDecimal shares, BigDecimal minOrderValue) {

	public static final int SIZE_SCALE = 4;

	public BigDecimal sizeFor(BigDecimal ask, BigDecimal venueMinimum) {
		BigDecimal size = shares;
		if (ask != null && ask.signum() > 0 && minOrderValue != null && minOrderValue.signum() > 0) {
			BigDecimal byValue = minOrderValue.divide(ask, SIZE_SCALE, RoundingMode.UP);
			size = size.max(byValue);
		}
		if (venueMinimum != null) {
			size = size.max(venueMinimum);
		}
		return truncate(size);
	}

	public static BigDecimal truncate(BigDecimal value) {
		return value.setScale(SIZE_SCALE, RoundingMode.DOWN);
	}
}
