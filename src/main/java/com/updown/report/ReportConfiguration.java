package com.updown.report;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import com.fasterxml.jackson.databind.ObjectMapper;

@Configuration
@EnableConfigurationProperties(ReportProperties.class)
public class ReportConfiguration {

	@Bean(initMethod = "start", destroyMethod = "shutdown")
	@ConditionalOnProperty(prefix = "report", name = "enabled", havingValue = "true", matchIfMissing = true)
	public JsonlReportWriter jsonlReportWriter(ReportProperties properties, ObjectMapper objectMapper) {
		return new JsonlReportWriter(properties, objectMapper);
	}

	@Bean
	@ConditionalOnProperty(prefix = "report", name = "enabled", havingValue = "false")
	public LogReportSink logReportSink(ObjectMapper objectMapper) {
		return new LogReportSink(objectMapper);
	}
}
