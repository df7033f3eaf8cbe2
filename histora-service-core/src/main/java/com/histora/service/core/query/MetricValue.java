package com.histora.service.core.query;

import java.time.Instant;

public record MetricValue(String metric, double value, Instant timestamp) {}
