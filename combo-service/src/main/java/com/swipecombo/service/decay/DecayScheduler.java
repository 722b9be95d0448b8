package com.swipecombo.service.decay;

import com.swipecombo.common.model.ComboState;
import com.swipecombo.common.trace.SessionLogContext;
import com.swipecombo.service.tracker.ComboTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Idle watchdog for one {@link ComboTracker}: forces a reset once a live streak has seen
 * no action for the decay window, even if no further action ever arrives.
 *
 * <p>Every published snapshot re-arms a single one-shot timer:
 * <pre>
 *   active state   → cancel previous timer → Mono.delay(remaining) → tracker.expire(state)
 *   inactive state → cancel previous timer
 * </pre>
 * {@code remaining} is the time left until {@code lastActionAt + decayWindow} on the
 * tracker's clock, clamped to {@code [0, decayWindow]}. At most one timer is outstanding
 * (held in a {@link Disposable.Swap}). A timer that loses the race against a fresh action
 * calls {@link ComboTracker#expire} with a superseded snapshot, which the tracker ignores
 * under its own monitor, so decay and action never both apply.
 *
 * <p>{@code Mono.delay()} does not hold a thread while waiting; the callback runs on the
 * supplied {@link Scheduler}.
 */
public class DecayScheduler implements Disposable {

    private static final Logger log = LoggerFactory.getLogger(DecayScheduler.class);

    private final ComboTracker    tracker;
    private final Scheduler       timer;
    private final Disposable.Swap pending = Disposables.swap();
    private final Disposable      subscription;

    private final AtomicReference<ComboState> armedFor = new AtomicReference<>();

    public DecayScheduler(ComboTracker tracker, Scheduler timer) {
        this.tracker      = tracker;
        this.timer        = timer;
        this.subscription = tracker.states().subscribe(
            this::onState,
            err -> log.error("Decay watch failed. sessionId={}", tracker.sessionId(), err),
            () -> cancelPending()
        );
    }

    // ── state observation ─────────────────────────────────────────────────────

    private void onState(ComboState state) {
        if (!state.active()) {
            cancelPending();
            return;
        }
        Duration delay = remaining(state);
        armedFor.set(state);
        pending.update(
            Mono.delay(delay, timer).subscribe(
                tick -> fire(state),
                err  -> log.error("Decay timer failed. sessionId={}", tracker.sessionId(), err)
            )
        );
        log.debug("COMBO_DECAY_ARMED sessionId={} count={} delayMs={}",
                  tracker.sessionId(), state.count(), delay.toMillis());
    }

    private void fire(ComboState state) {
        armedFor.compareAndSet(state, null);
        boolean decayed = tracker.expire(state);
        if (!decayed) {
            SessionLogContext.withMdc(tracker.sessionId(), () ->
                log.debug("COMBO_DECAY_STALE sessionId={} count={}", tracker.sessionId(), state.count()));
        }
    }

    /** Time left until the streak decays, measured on the tracker's clock. */
    Duration remaining(ComboState state) {
        Duration window  = tracker.decayWindow();
        Instant  now     = tracker.clock().instant();
        Duration elapsed = Duration.between(state.lastActionAt(), now);
        if (elapsed.isNegative()) {
            return window;
        }
        if (elapsed.compareTo(window) >= 0) {
            return Duration.ZERO;
        }
        return window.minus(elapsed);
    }

    private void cancelPending() {
        armedFor.set(null);
        pending.update(Disposables.disposed());
    }

    // ── lifecycle ─────────────────────────────────────────────────────────────

    /** True while a decay timer is outstanding. */
    public boolean isArmed() {
        return armedFor.get() != null && !pending.isDisposed();
    }

    /** Cancels the outstanding timer and stops watching the tracker. */
    @Override
    public void dispose() {
        subscription.dispose();
        armedFor.set(null);
        pending.dispose();
    }

    @Override
    public boolean isDisposed() {
        return pending.isDisposed();
    }
}
