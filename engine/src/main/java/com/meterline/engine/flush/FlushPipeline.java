package com.meterline.engine.flush;

import com.meterline.core.error.WorkerUnavailableException;
import com.meterline.core.model.FlushInterval;
import com.meterline.core.model.MetricBatch;
import com.meterline.core.model.MetricKind;
import com.meterline.core.model.MetricRecord;
import com.meterline.core.model.TickEvent;
import com.meterline.core.msg.Topics;
import com.meterline.core.runtime.Actor;
import com.meterline.core.runtime.ActorSystem;
import com.meterline.engine.metrics.EngineMetrics;
import com.meterline.engine.store.IMetricStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Interval-keyed queue of metric batches, drained to the metric store on each tick.
 * <p>
 * <b>Strategies:</b> checkpoint batches become one atomic increment each, applied in submission
 * order so a billing reset lands after the increments queued before it; every other batch
 * of the drain goes into a single bulk insert. A reset drains its interval without waiting
 * for the tick.
 * </p>
 * <p>
 * <b>Retention:</b> a drain works on a snapshot of its interval's queue. The snapshot is
 * removed only when every write succeeded; otherwise it stays queued for the next tick.
 * One drain per interval runs at a time.
 * </p>
 */
public class FlushPipeline extends Actor<FlushMessage> implements BatchSink {
    private static final Logger log = LoggerFactory.getLogger(FlushPipeline.class);

    public static final String KEY = "flush-pipeline";

    static final String STRATEGY_CHECKPOINT = "checkpoint";
    static final String STRATEGY_INSERT = "insert";

    private final IMetricStore store;
    private final EngineMetrics metrics;
    private final Duration settleDelay;

    private final Map<FlushInterval, List<MetricBatch>> queues = new EnumMap<>(FlushInterval.class);
    private final Map<FlushInterval, Mono<Void>> inFlight = new EnumMap<>(FlushInterval.class);
    private final AtomicInteger pending = new AtomicInteger();

    public FlushPipeline(ActorSystem system, IMetricStore store, EngineMetrics metrics, Duration settleDelay) {
        super(KEY, FlushMessage.class, system);
        this.store = store;
        this.metrics = metrics;
        this.settleDelay = settleDelay;
    }

    @Override
    public String kind() {
        return "flush";
    }

    @Override
    protected void preStart() {
        subscribe(Topics.TICK_ALL, TickEvent.class, tick -> new FlushMessage.Tick(tick.interval()));
    }

    @Override
    public void submit(MetricBatch batch) {
        if (!tell(new FlushMessage.Enqueue(batch))) {
            log.warn("Flush pipeline rejected batch {}/{} for {}", batch.getScope(), batch.getMetricName(),
                batch.getBusinessId());
        }
    }

    /**
     * Drains every interval. Completes when all writes finished, with the first error otherwise.
     */
    public Mono<Void> flushAll() {
        return Mono.create(sink -> {
            if (!tell(new FlushMessage.FlushAll(sink))) {
                sink.error(new WorkerUnavailableException(KEY, "stopped"));
            }
        });
    }

    public int pendingBatches() {
        return pending.get();
    }

    @Override
    protected void onMessage(FlushMessage message) {
        if (message instanceof FlushMessage.Enqueue enqueue) {
            MetricBatch batch = enqueue.batch();
            queues.computeIfAbsent(batch.getFlushInterval(), i -> new ArrayList<>()).add(batch);
            pending.incrementAndGet();
            if (batch.isReset()) {
                scheduleDrain(batch.getFlushInterval());
            }
        } else if (message instanceof FlushMessage.Tick tick) {
            scheduleDrain(tick.interval());
        } else if (message instanceof FlushMessage.Drain drain) {
            drain(drain.interval());
        } else if (message instanceof FlushMessage.DrainFinished finished) {
            onDrainFinished(finished);
        } else if (message instanceof FlushMessage.FlushAll flushAll) {
            List<Mono<Void>> drains = new ArrayList<>();
            for (FlushInterval interval : FlushInterval.values()) {
                drains.add(drain(interval));
            }
            Mono.whenDelayError(drains).subscribe(
                null,
                flushAll.reply()::error,
                flushAll.reply()::success
            );
        }
    }

    private void scheduleDrain(FlushInterval interval) {
        List<MetricBatch> queue = queues.get(interval);
        if (queue == null || queue.isEmpty()) {
            return;
        }
        if (settleDelay.isZero()) {
            drain(interval);
            return;
        }
        Mono.delay(settleDelay, system.getScheduler())
            .subscribe(ignored -> tell(new FlushMessage.Drain(interval)));
    }

    private Mono<Void> drain(FlushInterval interval) {
        Mono<Void> running = inFlight.get(interval);
        if (running != null) {
            return running;
        }
        List<MetricBatch> queue = queues.get(interval);
        if (queue == null || queue.isEmpty()) {
            return Mono.empty();
        }

        List<MetricBatch> snapshot = List.copyOf(queue);
        long start = System.nanoTime();
        Mono<Void> write = write(interval, snapshot)
            .doOnSuccess(v -> tell(new FlushMessage.DrainFinished(interval, snapshot.size(), null, start)))
            .doOnError(e -> tell(new FlushMessage.DrainFinished(interval, snapshot.size(), e, start)))
            .cache();
        inFlight.put(interval, write);
        write.subscribe(
            null,
            e -> log.debug("Drain of {} failed: {}", interval.label(), e.toString())
        );
        return write;
    }

    private Mono<Void> write(FlushInterval interval, List<MetricBatch> snapshot) {
        Map<Boolean, List<MetricBatch>> byStrategy = snapshot.stream()
            .collect(Collectors.partitioningBy(batch -> batch.getKind() == MetricKind.CHECKPOINT));
        List<MetricBatch> checkpoints = byStrategy.get(true);
        List<MetricRecord> rows = byStrategy.get(false).stream()
            .map(MetricBatch::toRecord)
            .collect(Collectors.toList());

        Mono<Void> increments = Flux.fromIterable(checkpoints)
            .concatMapDelayError(this::writeCheckpoint)
            .then()
            .doOnSuccess(v -> metrics.recordFlushed(interval, STRATEGY_CHECKPOINT, checkpoints.size()));
        Mono<Void> inserts = rows.isEmpty()
            ? Mono.empty()
            : store.batchInsert(rows)
                .doOnSuccess(v -> metrics.recordFlushed(interval, STRATEGY_INSERT, rows.size()));

        return Mono.whenDelayError(increments, inserts);
    }

    private Mono<Void> writeCheckpoint(MetricBatch batch) {
        if (batch.isReset()) {
            return store.resetCheckpoint(batch.getBusinessId(), batch.getCustomerId(),
                batch.getMetricName(), batch.getAggregatedValue(), batch.getScope());
        }
        return store.atomicIncrement(batch.getBusinessId(), batch.getCustomerId(),
            batch.getMetricName(), batch.getDelta(), batch.getScope(), batch.getTags());
    }

    private void onDrainFinished(FlushMessage.DrainFinished finished) {
        FlushInterval interval = finished.interval();
        inFlight.remove(interval);
        metrics.recordFlushLatency(interval, finished.startNanos());
        if (finished.error() != null) {
            metrics.recordFlushFailure(interval);
            log.warn("Flush of {} batches for {} failed, retaining them for the next tick: {}",
                finished.drained(), interval.label(), finished.error().toString());
            return;
        }
        List<MetricBatch> queue = queues.get(interval);
        queue.subList(0, finished.drained()).clear();
        pending.addAndGet(-finished.drained());
        log.debug("Flushed {} batches for {}", finished.drained(), interval.label());
    }
}
