package com.meterline.engine;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Node status served on {@code /status}.
 */
@Value
@Builder
public class EngineStatus {
    String nodeId;
    boolean ready;
    int liveWorkers;
    long businesses;
    long customers;
    long metrics;
    long ipCounters;
    int pendingBatches;

    /**
     * Next tick per interval label, epoch milliseconds.
     */
    Map<String, Long> nextFireTimes;
}
