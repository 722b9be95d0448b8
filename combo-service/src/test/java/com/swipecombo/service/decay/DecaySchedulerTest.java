package com.swipecombo.service.decay;

import com.swipecombo.common.classifier.LevelClassifier;
import com.swipecombo.common.model.ComboLevel;
import com.swipecombo.common.model.ComboState;
import com.swipecombo.service.time.SchedulerClock;
import com.swipecombo.service.tracker.ComboTracker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Decay timing on a {@link VirtualTimeScheduler}: the tracker's clock and the timers share
 * one virtual time base, so every boundary is exact.
 */
class DecaySchedulerTest {

    private static final Duration WINDOW = Duration.ofMillis(2000);

    private VirtualTimeScheduler vts;
    private ComboTracker         tracker;
    private DecayScheduler       decay;

    @BeforeEach
    void setUp() {
        vts     = VirtualTimeScheduler.create();
        tracker = new ComboTracker("decay-test", LevelClassifier.defaults(), WINDOW, new SchedulerClock(vts));
        decay   = new DecayScheduler(tracker, vts);
    }

    @AfterEach
    void tearDown() {
        decay.dispose();
        tracker.close();
        vts.dispose();
    }

    private void advance(long millis) {
        vts.advanceTimeBy(Duration.ofMillis(millis));
    }

    @Test
    @DisplayName("idle streak decays to {0, NONE, inactive} with no external trigger")
    void idleDecay() {
        tracker.recordAction();

        advance(1999);
        assertTrue(tracker.currentState().active());
        assertEquals(1, tracker.currentState().count());

        advance(2);
        ComboState state = tracker.currentState();
        assertEquals(0, state.count());
        assertEquals(ComboLevel.NONE, state.level());
        assertFalse(state.active());
        assertEquals(1, state.maxCount());
        assertFalse(decay.isArmed());
    }

    @Test
    @DisplayName("each action re-arms the timer from its own timestamp")
    void rearmOnAction() {
        tracker.recordAction();
        advance(1500);
        tracker.recordAction();

        advance(1999);
        assertEquals(2, tracker.currentState().count());
        assertTrue(decay.isArmed());

        advance(2);
        assertTrue(tracker.currentState().isIdle());
    }

    @Test
    @DisplayName("decay publishes exactly one reset per idle streak")
    void singleResetPerStreak() {
        List<ComboState> seen = new ArrayList<>();
        tracker.states().subscribe(seen::add);

        tracker.recordAction();
        advance(500);
        tracker.recordAction();
        advance(10_000);

        long resets = seen.stream().skip(1).filter(ComboState::isIdle).count();
        assertEquals(1, resets);
        assertEquals(4, seen.size());
    }

    @Test
    @DisplayName("explicit reset disarms the timer")
    void resetDisarms() {
        tracker.recordAction();
        assertTrue(decay.isArmed());

        tracker.reset();
        assertFalse(decay.isArmed());

        advance(5000);
        assertTrue(tracker.currentState().isIdle());
    }

    @Test
    @DisplayName("timer armed for an old streak cannot reset the new one")
    void staleTimerIsNoop() {
        ComboState first = tracker.recordAction();
        advance(100);
        tracker.recordAction();

        assertFalse(tracker.expire(first));
        assertEquals(2, tracker.currentState().count());
    }

    @Test
    @DisplayName("remaining time is measured from lastActionAt on the tracker clock")
    void remainingFromLastAction() {
        advance(10_000);
        ComboState state = tracker.recordAction(Instant.ofEpochMilli(9_400));

        assertEquals(Duration.ofMillis(1400), decay.remaining(state));

        advance(1399);
        assertTrue(tracker.currentState().active());
        advance(1);
        assertTrue(tracker.currentState().isIdle());
    }

    @Test
    @DisplayName("action stamped in the future gets a full window")
    void futureTimestamp() {
        ComboState state = tracker.recordAction(Instant.ofEpochMilli(60_000));
        assertEquals(WINDOW, decay.remaining(state));
    }

    @Test
    @DisplayName("disposing the watchdog cancels the pending reset")
    void disposeCancels() {
        tracker.recordAction();
        decay.dispose();

        advance(10_000);
        assertTrue(tracker.currentState().active());
        assertFalse(decay.isArmed());
        assertTrue(decay.isDisposed());
    }

    @Test
    @DisplayName("closing the tracker stops the watchdog from firing into it")
    void closeTracker() {
        tracker.recordAction();
        tracker.close();

        advance(10_000);
        assertEquals(1, tracker.currentState().count());
        assertFalse(decay.isArmed());
    }
}
