package com.updown.report;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

/**
 * Appends window reports as JSON Lines, one file per UTC day. Writes happen on a background
 * daemon thread fed by a bounded queue; when the queue is full the report is dropped and a
 * warning is logged at most every 30 seconds.
 */
public class JsonlReportWriter implements ReportSink {

	private static final Logger log = LoggerFactory.getLogger(JsonlReportWriter.class);
	private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.BASIC_ISO_DATE;
	private static final long DROP_WARN_INTERVAL_MS = 30000;

	private final ReportProperties properties;
	private final ObjectWriter objectWriter;
	private final BlockingQueue<WindowReport> queue;
	private final AtomicLong droppedCounter = new AtomicLong();
	private final AtomicLong lastWarnEpochMs = new AtomicLong();

	private volatile boolean running;
	private Thread writerThread;
	private BufferedWriter writer;
	private LocalDate currentDate;

	public JsonlReportWriter(ReportProperties properties, ObjectMapper objectMapper) {
		this.properties = properties;
		this.objectWriter = objectMapper.writer();
		this.queue = new ArrayBlockingQueue<>(properties.getWriterQueueCapacity());
	}

	public void start() {
		if (running) {
			return;
		}
		running = true;
		writerThread = new Thread(this::runLoop, "report-writer");
		writerThread.setDaemon(true);
		writerThread.start();
		log.info("EVENT=REPORT_WRITER_STARTED baseDir={}", properties.getBaseDir());
	}

	@Override
	public void append(WindowReport report) {
		if (!queue.offer(report)) {
			long dropped = droppedCounter.incrementAndGet();
			long now = System.currentTimeMillis();
			long lastWarn = lastWarnEpochMs.get();
			if (now - lastWarn > DROP_WARN_INTERVAL_MS && lastWarnEpochMs.compareAndSet(lastWarn, now)) {
				log.warn("EVENT=REPORT_DROPPED droppedCount={} window={}", dropped, report.windowId());
			}
		}
	}

	public long droppedCount() {
		return droppedCounter.get();
	}

	public void shutdown() {
		running = false;
		if (writerThread != null) {
			writerThread.interrupt();
			try {
				writerThread.join(2000);
			} catch (InterruptedException ex) {
				Thread.currentThread().interrupt();
			}
		}
	}

	private void runLoop() {
		long lastFlush = System.currentTimeMillis();
		try {
			while (running || !queue.isEmpty()) {
				try {
					WindowReport report = queue.poll(500, TimeUnit.MILLISECONDS);
					if (report != null) {
						write(report);
					}
					long now = System.currentTimeMillis();
					if (now - lastFlush >= properties.getWriterFlushInterval().toMillis()) {
						flush();
						lastFlush = now;
					}
				} catch (InterruptedException ex) {
					// shutdown() interrupts; the loop drains what is left and exits
					running = false;
				} catch (Exception ex) {
					log.error("EVENT=REPORT_WRITE_ERROR message={}", ex.getMessage(), ex);
				}
			}
			flush();
		} finally {
			close();
		}
	}

	void write(WindowReport report) throws IOException {
		LocalDate date = report.recordedAt().atZone(ZoneOffset.UTC).toLocalDate();
		if (currentDate == null || !currentDate.equals(date)) {
			rotate(date);
		}
		writer.write(objectWriter.writeValueAsString(report));
		writer.write("\n");
	}

	Path fileFor(LocalDate date) {
		return properties.getBaseDir().resolve(properties.getFilePrefix() + "-" + DATE_FORMAT.format(date) + ".jsonl");
	}

	private void rotate(LocalDate date) throws IOException {
		close();
		Files.createDirectories(properties.getBaseDir());
		writer = Files.newBufferedWriter(fileFor(date), StandardCharsets.UTF_8, StandardOpenOption.CREATE,
				StandardOpenOption.APPEND);
		currentDate = date;
	}

	private void flush() {
		if (writer == null) {
			return;
		}
		try {
			writer.flush();
		} catch (IOException ex) {
			log.error("EVENT=REPORT_FLUSH_ERROR message={}", ex.getMessage(), ex);
		}
	}

	private void close() {
		if (writer == null) {
			return;
		}
		try {
			writer.flush();
			writer.close();
		} catch (IOException ex) {
			log.error("EVENT=REPORT_CLOSE_ERROR message={}", ex.getMessage(), ex);
		} finally {
			writer = null;
			currentDate = null;
		}
	}
}
