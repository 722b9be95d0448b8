package com.swipecombo.service.time;

import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.TimeUnit;

/**
 * {@link Clock} that reads time from a Reactor {@link Scheduler}.
 *
 * <p>Action timestamps and decay timers must share one time base, otherwise the timer's
 * "decay window from lastActionAt" drifts from the tracker's notion of elapsed time.
 * Backing the clock with the same scheduler that runs the timers keeps them aligned,
 * including under a virtual-time scheduler in tests.
 */
public final class SchedulerClock extends Clock {

    private final Scheduler scheduler;
    private final ZoneId    zone;

    public SchedulerClock(Scheduler scheduler) {
        this(scheduler, ZoneOffset.UTC);
    }

    private SchedulerClock(Scheduler scheduler, ZoneId zone) {
        this.scheduler = scheduler;
        this.zone      = zone;
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return zone.equals(this.zone) ? this : new SchedulerClock(scheduler, zone);
    }

    @Override
    public long millis() {
        return scheduler.now(TimeUnit.MILLISECONDS);
    }

    @Override
    public Instant instant() {
        return Instant.ofEpochMilli(millis());
    }
}
