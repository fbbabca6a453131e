package com.updown.engine;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;

import com.updown.market.MarketDirectory;
import com.updown.market.MarketWindow;

import jakarta.annotation.PreDestroy;

/**
 * Outer loop: discover the active window, run it to expiry, update the session counters, wait
 * for the next one. Runs on a single daemon thread; session counters are owned by that thread.
 */
public class EngineLoop implements ApplicationListener<ApplicationReadyEvent> {

	private static final Logger LOGGER = LoggerFactory.getLogger(EngineLoop.class);

	private final MarketDirectory directory;
	private final WindowRunner runner;
	private final Sleeper sleeper;
	private final Duration discoveryTimeout;
	private final Duration discoveryRetry;
	private final Duration nextWindowWait;
	private final Duration windowErrorWait;

	private volatile boolean running;
	private volatile SessionStats session = SessionStats.EMPTY;
	private Thread loopThread;
	private String lastWindowId;

	public EngineLoop(MarketDirectory directory, WindowRunner runner, Sleeper sleeper, Duration discoveryTimeout,
			Duration discoveryRetry, Duration nextWindowWait, Duration windowErrorWait) {
		this.directory = directory;
		this.runner = runner;
		this.sleeper = sleeper;
		this.discoveryTimeout = discoveryTimeout;
		this.discoveryRetry = discoveryRetry;
		this.nextWindowWait = nextWindowWait;
		this.windowErrorWait = windowErrorWait;
	}

	@Override
	public void onApplicationEvent(ApplicationReadyEvent event) {
		start();
	}

	public synchronized void start() {
		if (running) {
			return;
		}
		running = true;
		loopThread = new Thread(this::runLoop, "window-loop");
		loopThread.setDaemon(true);
		loopThread.start();
		LOGGER.info("EVENT=ENGINE_STARTED");
	}

	@PreDestroy
	public synchronized void shutdown() {
		running = false;
		if (loopThread != null) {
			loopThread.interrupt();
			try {
				loopThread.join(2000);
			} catch (InterruptedException ex) {
				Thread.currentThread().interrupt();
			}
		}
		LOGGER.info("EVENT=ENGINE_STOPPED {}", TickLogLineBuilder.buildSessionLine(session));
	}

	public SessionStats session() {
		return session;
	}

	void runLoop() {
		while (running && !Thread.currentThread().isInterrupted()) {
			try {
				step();
			} catch (InterruptedException ex) {
				Thread.currentThread().interrupt();
				return;
			}
		}
	}

	/**
	 * One discovery attempt and, when a new window is found, one full window run.
	 */
	void step() throws InterruptedException {
		MarketWindow window = discover();
		if (window == null) {
			LOGGER.info("EVENT=NO_ACTIVE_WINDOW retryIn={}", discoveryRetry);
			sleeper.sleep(discoveryRetry);
			return;
		}
		if (window.id().equals(lastWindowId)) {
			sleeper.sleep(nextWindowWait);
			return;
		}
		try {
			WindowOutcome outcome = runner.run(window);
			lastWindowId = window.id();
			session = session.after(outcome.settlement());
			LOGGER.info(TickLogLineBuilder.buildSessionLine(session));
			sleeper.sleep(nextWindowWait);
		} catch (RuntimeException ex) {
			lastWindowId = window.id();
			LOGGER.error("EVENT=WINDOW_ERROR window={} message={}", window.id(), ex.getMessage(), ex);
			sleeper.sleep(windowErrorWait);
		}
	}

	private MarketWindow discover() {
		try {
			return directory.findActiveWindow().block(discoveryTimeout);
		} catch (RuntimeException ex) {
			LOGGER.warn("EVENT=DISCOVERY_ERROR message={}", ex.getMessage());
			return null;
		}
	}
}
