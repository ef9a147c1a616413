package com.meterline.core.runtime;

import com.meterline.core.metrics.MetricsNames;
import com.meterline.core.metrics.MetricsTags;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.Builder;
import lombok.Getter;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

/**
 * Shared services handed to every actor: registry, supervisor, bus, scheduler and clock.
 * <p>
 * The scheduler must be asynchronous; mailboxes are drained on it and never inline.
 * </p>
 */
@Getter
public class ActorSystem {
    public static final int DEFAULT_MAILBOX_CAPACITY = 1024;

    private final ProcessRegistry registry;
    private final Supervisor supervisor;
    private final PubSub pubSub;
    private final Scheduler scheduler;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final int mailboxCapacity;

    @Builder
    private ActorSystem(ProcessRegistry registry, PubSub pubSub, Scheduler scheduler, Clock clock,
                        MeterRegistry meterRegistry, Integer mailboxCapacity) {
        this.registry = registry != null ? registry : new ProcessRegistry();
        this.pubSub = pubSub != null ? pubSub : new PubSub();
        this.scheduler = scheduler != null ? scheduler : Schedulers.parallel();
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.meterRegistry = meterRegistry != null ? meterRegistry : new SimpleMeterRegistry();
        this.mailboxCapacity = mailboxCapacity != null ? mailboxCapacity : DEFAULT_MAILBOX_CAPACITY;
        this.supervisor = new Supervisor(this.registry, this.meterRegistry);
    }

    public static ActorSystem create() {
        return builder().build();
    }

    void recordOverflow(String kind) {
        Counter.builder(MetricsNames.MAILBOX_OVERFLOW_TOTAL)
            .tag(MetricsTags.KIND, kind)
            .register(meterRegistry)
            .increment();
    }
}
