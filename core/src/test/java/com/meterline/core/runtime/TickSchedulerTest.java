package com.meterline.core.runtime;

import com.meterline.core.model.FlushInterval;
import com.meterline.core.model.TickEvent;
import com.meterline.core.msg.Topics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;

class TickSchedulerTest {

    // Aligned to a one-minute boundary
    private static final long T0 = 1_700_000_040_000L;

    private TestClock clock;
    private PubSub pubSub;
    private TickScheduler scheduler;
    private List<TickEvent> fiveSecondTicks;
    private List<TickEvent> allTicks;

    @BeforeEach
    void setUp() {
        clock = new TestClock(T0 + 1_000);
        pubSub = new PubSub();
        scheduler = new TickScheduler(pubSub, clock, TickScheduler.DEFAULT_RESOLUTION,
            List.of(FlushInterval.FIVE_SECONDS));
        fiveSecondTicks = new CopyOnWriteArrayList<>();
        allTicks = new CopyOnWriteArrayList<>();
        pubSub.subscribe(Topics.tick(FlushInterval.FIVE_SECONDS), TickEvent.class).subscribe(fiveSecondTicks::add);
        pubSub.subscribe(Topics.TICK_ALL, TickEvent.class).subscribe(allTicks::add);
        scheduler.align();
    }

    @Test
    void testAlignsToNextBoundary() {
        assertEquals(T0 + 5_000, scheduler.nextFireTime(FlushInterval.FIVE_SECONDS));
    }

    @Test
    void testFiresOnBoundaryOnTopicAndAll() {
        assertEquals(0, scheduler.poll());

        clock.set(T0 + 5_000);
        assertEquals(1, scheduler.poll());

        assertEquals(1, fiveSecondTicks.size());
        assertEquals(FlushInterval.FIVE_SECONDS, fiveSecondTicks.get(0).interval());
        assertEquals(T0 + 5_000, fiveSecondTicks.get(0).timestamp());
        assertEquals(1, allTicks.size());
        assertEquals(T0 + 10_000, scheduler.nextFireTime(FlushInterval.FIVE_SECONDS));
    }

    @Test
    void testSmallLatenessAdvancesByWholeIntervals() {
        clock.set(T0 + 12_500);

        assertEquals(1, scheduler.poll());

        assertEquals(1, fiveSecondTicks.size());
        assertEquals(T0 + 15_000, scheduler.nextFireTime(FlushInterval.FIVE_SECONDS));
    }

    @Test
    void testLargeDriftRealignsWithoutFlooding() {
        long late = T0 + 5_000 + 60_000 + 1_234;
        clock.set(late);

        assertEquals(1, scheduler.poll());
        assertEquals(0, scheduler.poll());

        assertEquals(1, fiveSecondTicks.size());
        assertEquals(FlushInterval.FIVE_SECONDS.nextBoundary(late),
            scheduler.nextFireTime(FlushInterval.FIVE_SECONDS));
    }

    @Test
    void testSecondsUntilNextRoundsUpAndIsAtLeastOne() {
        clock.set(T0 + 3_500);
        assertEquals(2, scheduler.secondsUntilNext(FlushInterval.FIVE_SECONDS));

        clock.set(T0 + 4_999);
        assertEquals(1, scheduler.secondsUntilNext(FlushInterval.FIVE_SECONDS));

        clock.set(T0 + 5_000);
        assertEquals(1, scheduler.secondsUntilNext(FlushInterval.FIVE_SECONDS));
    }

    @Test
    void testNextFireTimesCoverConfiguredIntervals() {
        TickScheduler all = new TickScheduler(pubSub, clock);
        all.align();

        assertEquals(FlushInterval.values().length, all.nextFireTimes().size());
        assertEquals(T0 + 60_000, (long) all.nextFireTimes().get(FlushInterval.ONE_MINUTE));
    }
}
