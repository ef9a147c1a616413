package com.meterline.engine.worker;

import com.meterline.core.runtime.ActorSystem;
import com.meterline.engine.config.EngineConfig;
import com.meterline.engine.flush.BatchSink;
import com.meterline.engine.metrics.EngineMetrics;
import com.meterline.engine.store.IMetricStore;
import lombok.Builder;
import lombok.Value;

/**
 * Services shared by every engine worker.
 */
@Value
@Builder
public class WorkerContext {
    ActorSystem system;
    EngineConfig config;
    IMetricStore store;
    BatchSink batchSink;
    @Builder.Default
    BreachListener breachListener = BreachListener.NOOP;
    EngineMetrics metrics;
}
