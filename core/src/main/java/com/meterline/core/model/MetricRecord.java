package com.meterline.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Persisted row shape for plain (non-checkpoint) batch inserts.
 */
@Value
@Builder
@Jacksonized
public class MetricRecord {
    String businessId;
    String customerId;
    String scope;
    String metricName;
    MetricKind metricType;
    double value;
    long operationCount;
    long windowStart;
    long windowEnd;
    long flushedAt;
    Map<String, String> tags;
}
