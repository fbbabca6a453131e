package com.updown.report;

/**
 * Append-only destination for window reports. Nothing written here is read back by the engine.
 */
public interface ReportSink {

	void append(WindowReport report);
}
