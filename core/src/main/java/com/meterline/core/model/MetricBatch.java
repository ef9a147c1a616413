package com.meterline.core.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Immutable snapshot of one metric window, produced at flush time and queued
 * in the flush pipeline until the matching tick drains it.
 */
@Value
@Builder(toBuilder = true)
public class MetricBatch {
    String businessId;
    String customerId;
    String scope;
    String metricName;
    MetricKind kind;
    Operation operation;
    FlushInterval flushInterval;

    /**
     * Aggregate at flush time.
     */
    double aggregatedValue;

    /**
     * Change since the previous flush; what a checkpoint increment adds to the stored total.
     */
    double delta;

    long operationCount;

    /**
     * Billing reset of a checkpoint: the stored total is set to {@link #aggregatedValue}
     * instead of incremented. Applied after the increments queued before it.
     */
    boolean reset;

    long windowStart;
    long windowEnd;
    Map<String, String> tags;

    public MetricRecord toRecord() {
        return MetricRecord.builder()
            .businessId(businessId)
            .customerId(customerId)
            .scope(scope)
            .metricName(metricName)
            .metricType(kind)
            .value(aggregatedValue)
            .operationCount(operationCount)
            .windowStart(windowStart)
            .windowEnd(windowEnd)
            .flushedAt(windowEnd)
            .tags(tags)
            .build();
    }
}
