package com.meterline.engine.flush;

import com.meterline.core.model.FlushInterval;
import com.meterline.core.model.MetricBatch;
import reactor.core.publisher.MonoSink;

/**
 * Mailbox messages of {@link FlushPipeline}.
 */
public interface FlushMessage {

    record Enqueue(MetricBatch batch) implements FlushMessage {
    }

    record Tick(FlushInterval interval) implements FlushMessage {
    }

    record Drain(FlushInterval interval) implements FlushMessage {
    }

    /**
     * @param error {@code null} when every write of the drain succeeded
     */
    record DrainFinished(FlushInterval interval, int drained, Throwable error, long startNanos) implements FlushMessage {
    }

    record FlushAll(MonoSink<Void> reply) implements FlushMessage {
    }
}
