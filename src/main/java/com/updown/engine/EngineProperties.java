package com.updown.engine;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import com.updown.strategy.ScoringPreset;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Engine tuning. Nullable overrides ({@code threshold}, {@code killSwitchPrice}) replace the
 * preset value when set; nullable constraint bounds switch that constraint off when unset.
 */
@Validated
@ConfigurationProperties(prefix = "engine")
public record EngineProperties(
		boolean enableOrders,
		@NotNull ScoringPreset scoringPreset,
		Integer threshold,
		Double killSwitchPrice,
		@Positive int bollingerPeriod,
		@Positive double bollingerStdDev,
		@Positive int atrPeriod,
		@Positive double atrMultiplier,
		@Positive int rsiPeriod,
		@Positive int candleCount,
		boolean recalibrateCandles,
		@Positive double barrierSaturation,
		@PositiveOrZero double depthRatioFloor,
		@Positive double depthRatioCap,
		@Positive double depthScanFraction,
		@PositiveOrZero double valueFloorPrice,
		@Positive double valueFullPrice,
		@Positive double valueZeroPrice,
		@PositiveOrZero double tradeWindowMinMinutes,
		@Positive double tradeWindowMaxMinutes,
		Double minContractPrice,
		Double maxContractPrice,
		Double minDepthRatio,
		@Positive double takeProfitPrice,
		@Positive double stopLossPct,
		@NotNull @Positive BigDecimal orderShares,
		@NotNull BigDecimal minOrderValue,
		@PositiveOrZero int orderMaxRetries,
		@NotNull Duration orderFirstBackoff,
		@NotNull Duration orderMaxBackoff,
		@NotNull Duration orderTimeout,
		@NotNull Duration tickInterval,
		@NotNull Duration nextWindowWait,
		@NotNull Duration discoveryRetry,
		@NotNull Duration windowErrorWait,
		@Positive int fetchWorkers,
		@NotNull Duration callTimeout,
		@NotEmpty List<String> priceSources) {
}
