package com.meterline.engine;

import com.meterline.core.model.FlushInterval;
import com.meterline.core.runtime.ActorRef;
import com.meterline.core.runtime.ActorSystem;
import com.meterline.core.runtime.ProcessRegistry;
import com.meterline.core.runtime.TickScheduler;
import com.meterline.engine.config.EngineConfig;
import com.meterline.engine.flush.FlushPipeline;
import com.meterline.engine.metrics.EngineMetrics;
import com.meterline.engine.ratelimit.IpRateLimiter;
import com.meterline.engine.store.IMetricStore;
import com.meterline.engine.worker.BreachListener;
import com.meterline.engine.worker.MetricMessage;
import com.meterline.engine.worker.TenantMessage;
import com.meterline.engine.worker.WorkerContext;
import com.meterline.engine.worker.WorkerKeys;
import com.meterline.provisioner.DeadLetterSink;
import com.meterline.provisioner.ProvisioningProcessor;
import com.meterline.provisioner.ProvisioningQueue;
import com.meterline.provisioner.config.ProvisioningConfig;
import com.meterline.provisioner.fly.IMachineProvider;
import com.meterline.provisioner.store.IProvisioningStore;
import lombok.Builder;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One engine node: the actor system with its workers, the flush pipeline, the rate limiter and
 * the provisioning processor, wired to the given stores and machine provider.
 * <p>
 * <b>Shutdown order:</b> ticks stop first, then tenant workers stop (their metric children
 * submit final batches), then the flush pipeline drains every interval, then the provisioning
 * processor and the pipeline stop.
 * </p>
 */
@Getter
public class MeterEngine {
    private static final Logger log = LoggerFactory.getLogger(MeterEngine.class);

    private final EngineConfig config;
    private final ActorSystem system;
    private final EngineMetrics metrics;
    private final TickScheduler ticks;
    private final FlushPipeline pipeline;
    private final WorkerContext context;
    private final MeterRouter router;
    private final IpRateLimiter rateLimiter;
    private final ProvisioningQueue provisioningQueue;
    private final ProvisioningProcessor provisioningProcessor;

    private final AtomicBoolean ready = new AtomicBoolean();
    private final AtomicBoolean shuttingDown = new AtomicBoolean();

    @Builder
    private MeterEngine(EngineConfig config, ProvisioningConfig provisioningConfig, IMetricStore metricStore,
                        IProvisioningStore provisioningStore, IMachineProvider machineProvider,
                        EngineMetrics metrics, Clock clock, Scheduler scheduler,
                        BreachListener breachListener, DeadLetterSink deadLetterSink) {
        this.config = config;
        Clock engineClock = clock != null ? clock : Clock.systemUTC();
        this.metrics = metrics;
        this.system = ActorSystem.builder()
            .clock(engineClock)
            .scheduler(scheduler)
            .meterRegistry(metrics.getRegistry())
            .mailboxCapacity(config.getMailboxCapacity())
            .build();
        this.ticks = new TickScheduler(system.getPubSub(), engineClock, config.getTickResolution(),
            EnumSet.allOf(FlushInterval.class));
        this.pipeline = new FlushPipeline(system, metricStore, metrics, config.getFlushSettleDelay());
        this.context = WorkerContext.builder()
            .system(system)
            .config(config)
            .store(metricStore)
            .batchSink(pipeline)
            .breachListener(breachListener != null ? breachListener : BreachListener.NOOP)
            .metrics(metrics)
            .build();
        this.router = new MeterRouter(context);
        this.rateLimiter = new IpRateLimiter(context, ticks);
        this.provisioningQueue = new ProvisioningQueue(provisioningStore, provisioningConfig, engineClock);
        this.provisioningProcessor = new ProvisioningProcessor(system, provisioningStore, machineProvider,
            provisioningQueue, provisioningConfig, router,
            deadLetterSink != null ? deadLetterSink : DeadLetterSink.NOOP);
    }

    /**
     * Starts the singleton actors and, when {@code withTicks} is set, the tick scheduler.
     */
    public void start(boolean withTicks) {
        ProcessRegistry registry = system.getRegistry();
        registry.register(FlushPipeline.KEY, pipeline);
        registry.register(ProvisioningProcessor.KEY, provisioningProcessor);
        pipeline.start();
        provisioningProcessor.start();

        metrics.bindWorkerGauges(registry);
        metrics.bindPendingBatches(pipeline::pendingBatches);

        if (withTicks) {
            ticks.start(system.getScheduler());
        }
        ready.set(true);
        log.info("Meter engine {} started", config.getNodeId());
    }

    public void start() {
        start(true);
    }

    public boolean isReady() {
        return ready.get() && !shuttingDown.get();
    }

    /**
     * Stops the node, flushing every pending window. Idempotent.
     */
    public Mono<Void> shutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return Mono.empty();
        }
        Duration timeout = config.getShutdownTimeout();
        return Mono.defer(() -> {
                log.info("Meter engine {} shutting down", config.getNodeId());
                ticks.stop();
                return stopAll(List.of(WorkerKeys.BUSINESS_PREFIX, WorkerKeys.CUSTOMER_PREFIX),
                    new TenantMessage.Shutdown());
            })
            .then(Mono.defer(() -> stopAll(List.of(WorkerKeys.METRIC_PREFIX, WorkerKeys.IP_PREFIX),
                new MetricMessage.Shutdown())))
            .timeout(timeout)
            .onErrorResume(err -> {
                log.warn("Workers did not stop within {} s: {}", timeout.toSeconds(), err.toString());
                return Mono.empty();
            })
            .then(Mono.defer(pipeline::flushAll)
                .timeout(timeout)
                .onErrorResume(err -> {
                    log.error("Final flush failed, {} batches not persisted: {}",
                        pipeline.pendingBatches(), err.toString());
                    return Mono.empty();
                }))
            .then(Mono.defer(() -> {
                provisioningProcessor.stop();
                pipeline.stop();
                return Mono.when(provisioningProcessor.whenTerminated(), pipeline.whenTerminated())
                    .timeout(timeout)
                    .onErrorResume(err -> {
                        log.warn("Engine actors did not terminate: {}", err.toString());
                        return Mono.empty();
                    });
            }))
            .doOnSuccess(v -> log.info("Meter engine {} stopped", config.getNodeId()));
    }

    /**
     * Tells every live worker under the prefixes to shut down and waits for all of them.
     */
    private Mono<Void> stopAll(List<String> prefixes, Object shutdown) {
        return Flux.fromIterable(prefixes)
            .flatMapIterable(prefix -> system.getRegistry().withPrefix(prefix))
            .doOnNext(ref -> ref.offer(shutdown))
            .flatMap(ActorRef::whenTerminated)
            .then();
    }

    public EngineStatus status() {
        ProcessRegistry registry = system.getRegistry();
        Map<String, Long> nextFire = new LinkedHashMap<>();
        ticks.nextFireTimes().forEach((interval, at) -> nextFire.put(interval.label(), at));
        return EngineStatus.builder()
            .nodeId(config.getNodeId())
            .ready(isReady())
            .liveWorkers(registry.size())
            .businesses(registry.countWithPrefix(WorkerKeys.BUSINESS_PREFIX))
            .customers(registry.countWithPrefix(WorkerKeys.CUSTOMER_PREFIX))
            .metrics(registry.countWithPrefix(WorkerKeys.METRIC_PREFIX))
            .ipCounters(registry.countWithPrefix(WorkerKeys.IP_PREFIX))
            .pendingBatches(pipeline.pendingBatches())
            .nextFireTimes(nextFire)
            .build();
    }
}
