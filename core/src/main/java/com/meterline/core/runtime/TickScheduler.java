package com.meterline.core.runtime;

import com.meterline.core.model.FlushInterval;
import com.meterline.core.model.TickEvent;
import com.meterline.core.msg.Topics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Publishes boundary-aligned {@link TickEvent}s for every {@link FlushInterval}.
 * <p>
 * <b>Scheduling:</b>
 * <ul>
 *   <li>First fire of each interval: {@code now + (interval - now % interval)}</li>
 *   <li>Wakes every {@code resolution} and publishes each due interval once, on
 *       {@code tick:<interval>} and {@code tick:all}</li>
 *   <li>After a wake later than {@value #DRIFT_THRESHOLD_MS} ms the next fire is realigned to the
 *       next clean boundary; otherwise it advances by whole intervals past {@code now}</li>
 * </ul>
 * </p>
 */
public class TickScheduler {
    private static final Logger log = LoggerFactory.getLogger(TickScheduler.class);

    public static final long DRIFT_THRESHOLD_MS = 10_000;
    public static final Duration DEFAULT_RESOLUTION = Duration.ofMillis(250);

    private final PubSub pubSub;
    private final Clock clock;
    private final Duration resolution;
    private final Set<FlushInterval> intervals;
    private final Map<FlushInterval, Long> nextFire = new EnumMap<>(FlushInterval.class);
    private Disposable ticker;

    public TickScheduler(PubSub pubSub, Clock clock) {
        this(pubSub, clock, DEFAULT_RESOLUTION, EnumSet.allOf(FlushInterval.class));
    }

    public TickScheduler(PubSub pubSub, Clock clock, Duration resolution, Collection<FlushInterval> intervals) {
        this.pubSub = pubSub;
        this.clock = clock;
        this.resolution = resolution;
        this.intervals = EnumSet.copyOf(intervals);
    }

    public synchronized void start() {
        start(Schedulers.parallel());
    }

    public synchronized void start(Scheduler scheduler) {
        if (ticker != null && !ticker.isDisposed()) {
            return;
        }
        align();
        ticker = Flux.interval(resolution, resolution, scheduler)
            .subscribe(i -> poll(), err -> log.error("Tick scheduler stopped", err));
        log.info("Tick scheduler started: {} intervals, resolution {} ms", intervals.size(), resolution.toMillis());
    }

    public synchronized void stop() {
        if (ticker != null) {
            ticker.dispose();
            ticker = null;
            log.info("Tick scheduler stopped");
        }
    }

    /**
     * Aligns every interval to its next boundary from the current clock.
     */
    public synchronized void align() {
        long now = clock.millis();
        for (FlushInterval interval : intervals) {
            nextFire.put(interval, interval.nextBoundary(now));
        }
    }

    /**
     * One wake: publishes every due interval once and schedules its next fire.
     *
     * @return number of ticks published
     */
    public synchronized int poll() {
        if (nextFire.isEmpty()) {
            align();
            return 0;
        }
        long now = clock.millis();
        int fired = 0;
        for (FlushInterval interval : intervals) {
            long due = nextFire.get(interval);
            if (now < due) {
                continue;
            }
            TickEvent event = new TickEvent(interval, now);
            pubSub.publish(Topics.tick(interval), event);
            pubSub.publish(Topics.TICK_ALL, event);
            fired++;

            long late = now - due;
            long next;
            if (late > DRIFT_THRESHOLD_MS) {
                next = interval.nextBoundary(now);
                log.warn("Tick {} fired {} ms late, realigning to {}", interval, late, next);
            } else {
                next = due;
                while (next <= now) {
                    next += interval.millis();
                }
            }
            nextFire.put(interval, next);
            log.debug("Tick {} at {}, next at {}", interval, now, next);
        }
        return fired;
    }

    /**
     * Epoch millis of the next fire of {@code interval}.
     */
    public synchronized long nextFireTime(FlushInterval interval) {
        Long next = nextFire.get(interval);
        return next != null ? next : interval.nextBoundary(clock.millis());
    }

    /**
     * Whole seconds until the next fire of {@code interval}, at least 1.
     */
    public long secondsUntilNext(FlushInterval interval) {
        long remainingMs = nextFireTime(interval) - clock.millis();
        return Math.max(1, (remainingMs + 999) / 1000);
    }

    public synchronized Map<FlushInterval, Long> nextFireTimes() {
        return new EnumMap<>(nextFire);
    }
}
