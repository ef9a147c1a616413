package com.meterline.engine.flush;

import com.meterline.core.model.MetricBatch;

/**
 * Accepts batches produced by metric workers at flush time.
 */
@FunctionalInterface
public interface BatchSink {
    void submit(MetricBatch batch);
}
