package com.updown.engine;

import com.updown.position.Settlement;
import com.updown.report.WindowReport;

public record WindowOutcome(Settlement settlement, WindowStatistics statistics, WindowReport report) {
}
