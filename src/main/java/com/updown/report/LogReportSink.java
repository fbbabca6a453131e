package com.updown.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

/**
 * Used when the JSONL journal is disabled: the report goes to the application log as JSON.
 */
public class LogReportSink implements ReportSink {

	private static final Logger log = LoggerFactory.getLogger(LogReportSink.class);

	private final ObjectWriter objectWriter;

	public LogReportSink(ObjectMapper objectMapper) {
		this.objectWriter = objectMapper.writer();
	}

	@Override
	public void append(WindowReport report) {
		try {
			log.info("EVENT=WINDOW_REPORT json={}", objectWriter.writeValueAsString(report));
		} catch (JsonProcessingException ex) {
			log.warn("EVENT=WINDOW_REPORT_SERIALIZE_FAILED window={} message={}", report.windowId(), ex.getMessage());
		}
	}
}
