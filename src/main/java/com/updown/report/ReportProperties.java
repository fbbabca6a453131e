package com.updown.report;

import java.nio.file.Path;
import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

@Validated
@ConfigurationProperties(prefix = "report")
public class ReportProperties {

	private boolean enabled = true;
	@NotNull
	private Path baseDir = Path.of("reports");
	private String filePrefix = "windows";
	@Min(1)
	private int writerQueueCapacity = 1000;
	@NotNull
	private Duration writerFlushInterval = Duration.ofSeconds(5);

	public boolean isEnabled() {
		return enabled;
	}

	public void setEnabled(boolean enabled) {
		this.enabled = enabled;
	}

	public Path getBaseDir() {
		return baseDir;
	}

	public void setBaseDir(Path baseDir) {
		this.baseDir = baseDir;
	}

	public String getFilePrefix() {
		return filePrefix;
	}

	public void setFilePrefix(String filePrefix) {
		this.filePrefix = filePrefix;
	}

	public int getWriterQueueCapacity() {
		return writerQueueCapacity;
	}

	public void setWriterQueueCapacity(int writerQueueCapacity) {
		this.writerQueueCapacity = writerQueueCapacity;
	}

	public Duration getWriterFlushInterval() {
		return writerFlushInterval;
	}

	public void setWriterFlushInterval(Duration writerFlushInterval) {
		this.writerFlushInterval = writerFlushInterval;
	}
}
