package com.swipecombo.service.session;

import com.swipecombo.common.model.ComboLevel;
import com.swipecombo.common.model.ComboState;
import com.swipecombo.service.decay.DecayScheduler;
import com.swipecombo.service.tracker.ComboTracker;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;

import java.time.Instant;

/**
 * Handle for one sorting session: its {@link ComboTracker} plus the
 * {@link DecayScheduler} watching it.
 *
 * <p>Whatever needs the combo (gesture pipeline, renderer, haptics) receives this handle
 * by reference; there is no shared global combo. Disposing the session cancels the decay
 * timer first, then closes the tracker, so no reset can fire into a finished session.
 */
public class ComboSession implements Disposable {

    private final String         id;
    private final ComboTracker   tracker;
    private final DecayScheduler decay;

    public ComboSession(ComboTracker tracker, Scheduler timer) {
        this.id      = tracker.sessionId();
        this.tracker = tracker;
        this.decay   = new DecayScheduler(tracker, timer);
    }

    public String id() {
        return id;
    }

    public ComboState recordAction() {
        return tracker.recordAction();
    }

    public ComboState recordAction(Instant now) {
        return tracker.recordAction(now);
    }

    public ComboState reset() {
        return tracker.reset();
    }

    public ComboState reset(Instant now) {
        return tracker.reset(now);
    }

    public ComboState currentState() {
        return tracker.currentState();
    }

    public Flux<ComboState> states() {
        return tracker.states();
    }

    /** Level transitions only; repeated snapshots at the same level are dropped. */
    public Flux<ComboLevel> levels() {
        return tracker.states()
            .map(ComboState::level)
            .distinctUntilChanged();
    }

    public boolean isDecayArmed() {
        return decay.isArmed();
    }

    @Override
    public void dispose() {
        decay.dispose();
        tracker.close();
    }

    @Override
    public boolean isDisposed() {
        return tracker.isClosed();
    }
}
