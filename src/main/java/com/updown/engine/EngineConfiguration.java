package com.updown.engine;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.updown.config.VenueProperties;
import com.updown.exchange.ContractBookSource;
import com.updown.exchange.OrderExecution;
import com.updown.exchange.OrderRetryPolicy;
import com.updown.exchange.PaperOrderExecution;
import com.updown.market.GammaMarketDirectory;
import com.updown.market.MarketDirectory;
import com.updown.market.PriceSource;
import com.updown.market.RankedPriceFeed;
import com.updown.market.ReferenceDepthSource;
import com.updown.position.EntrySizing;
import com.updown.position.ExitRules;
import com.updown.position.PositionStateMachine;
import com.updown.report.ReportSink;
import com.updown.strategy.IndicatorSettings;
import com.updown.strategy.ScoreCalculator;
import com.updown.strategy.ScoringParameters;
import com.updown.strategy.ScoringProfile;
import com.updown.strategy.constraint.ConstraintGate;
import com.updown.strategy.constraint.ContractPriceBounds;
import com.updown.strategy.constraint.DepthRatioFloor;
import com.updown.strategy.constraint.HardConstraint;

import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

@Configuration
@EnableConfigurationProperties(EngineProperties.class)
public class EngineConfiguration {

	private static final Logger LOGGER = LoggerFactory.getLogger(EngineConfiguration.class);

	@Bean
	public Clock clock() {
		return Clock.systemUTC();
	}

	@Bean
	public Sleeper sleeper() {
		return Sleeper.THREAD;
	}

	@Bean(destroyMethod = "dispose")
	public Scheduler tickFetchScheduler(EngineProperties properties) {
		return Schedulers.newBoundedElastic(properties.fetchWorkers(), 64, "tick-fetch");
	}

	@Bean
	public RankedPriceFeed rankedPriceFeed(List<PriceSource> sources, EngineProperties properties) {
		RankedPriceFeed feed = RankedPriceFeed.ordered(sources, properties.priceSources(), properties.callTimeout());
		LOGGER.info("EVENT=PRICE_SOURCES order={}", feed.sourceNames());
		return feed;
	}

	@Bean
	public MarketDirectory marketDirectory(@Qualifier("gammaWebClient") WebClient gammaWebClient,
			VenueProperties venueProperties, ObjectMapper objectMapper, Clock clock) {
		return new GammaMarketDirectory(gammaWebClient, venueProperties, objectMapper, clock);
	}

	@Bean
	public OrderExecution orderExecution(ContractBookSource bookSource, EngineProperties properties) {
		if (properties.enableOrders()) {
			LOGGER.warn("EVENT=LIVE_ORDERS_UNAVAILABLE execution=PAPER reason=no signed order client configured");
		} else {
			LOGGER.info("EVENT=PAPER_EXECUTION");
		}
		return new PaperOrderExecution(bookSource);
	}

	@Bean
	public OrderRetryPolicy orderRetryPolicy(EngineProperties properties) {
		return new OrderRetryPolicy(properties.orderMaxRetries(), properties.orderFirstBackoff(),
				properties.orderMaxBackoff());
	}

	@Bean
	public ScoreCalculator scoreCalculator(EngineProperties properties) {
		ScoringProfile profile = properties.scoringPreset().profile();
		if (properties.threshold() != null) {
			profile = profile.withThreshold(properties.threshold());
		}
		if (properties.killSwitchPrice() != null) {
			profile = profile.withKillSwitchPrice(properties.killSwitchPrice());
		}
		ScoringParameters parameters = new ScoringParameters(properties.atrMultiplier(),
				properties.barrierSaturation(), properties.depthRatioFloor(), properties.depthRatioCap(),
				properties.depthScanFraction(), properties.valueFloorPrice(), properties.valueFullPrice(),
				properties.valueZeroPrice());
		LOGGER.info("EVENT=SCORING_PROFILE preset={} profile={}", properties.scoringPreset(), profile);
		return new ScoreCalculator(profile, parameters);
	}

	@Bean
	public ConstraintGate constraintGate(EngineProperties properties) {
		List<HardConstraint> constraints = new ArrayList<>();
		if (properties.minContractPrice() != null || properties.maxContractPrice() != null) {
			double min = properties.minContractPrice() == null ? 0.0 : properties.minContractPrice();
			double max = properties.maxContractPrice() == null ? 1.0 : properties.maxContractPrice();
			constraints.add(new ContractPriceBounds(min, max));
		}
		if (properties.minDepthRatio() != null) {
			constraints.add(new DepthRatioFloor(properties.minDepthRatio()));
		}
		return new ConstraintGate(constraints);
	}

	@Bean
	public TickDataFetcher tickDataFetcher(RankedPriceFeed priceFeed, ContractBookSource bookSource,
			ReferenceDepthSource depthSource, @Qualifier("tickFetchScheduler") Scheduler scheduler,
			EngineProperties properties) {
		return new TickDataFetcher(priceFeed, bookSource, depthSource, scheduler, properties.candleCount(),
				properties.callTimeout());
	}

	@Bean
	public WindowRunner windowRunner(TickDataFetcher fetcher, ScoreCalculator calculator, ConstraintGate gate,
			OrderExecution orderExecution, OrderRetryPolicy retryPolicy, ReportSink reportSink,
			EngineProperties properties, Clock clock, Sleeper sleeper) {
		IndicatorSettings indicatorSettings = new IndicatorSettings(properties.bollingerPeriod(),
				properties.bollingerStdDev(), properties.atrPeriod(), properties.rsiPeriod());
		TradeWindow tradeWindow = new TradeWindow(properties.tradeWindowMinMinutes(),
				properties.tradeWindowMaxMinutes());
		EntrySizing sizing = new EntrySizing(properties.orderShares(), properties.minOrderValue());
		ExitRules exitRules = new ExitRules(properties.takeProfitPrice(), properties.stopLossPct());
		return new WindowRunner(fetcher, calculator, gate, indicatorSettings, properties.recalibrateCandles(),
				tradeWindow, properties.tickInterval(),
				window -> new PositionStateMachine(window, orderExecution, retryPolicy, sizing, exitRules,
						properties.orderTimeout()),
				reportSink, clock, sleeper);
	}

	@Bean
	public EngineLoop engineLoop(MarketDirectory directory, WindowRunner runner, Sleeper sleeper,
			EngineProperties properties) {
		return new EngineLoop(directory, runner, sleeper, properties.callTimeout().multipliedBy(2),
				properties.discoveryRetry(), properties.nextWindowWait(), properties.windowErrorWait());
	}
}
