package com.swipecombo.service.tracker;

import com.swipecombo.common.classifier.LevelClassifier;
import com.swipecombo.common.exception.ComboConfigurationException;
import com.swipecombo.common.model.ComboLevel;
import com.swipecombo.common.model.ComboState;
import com.swipecombo.common.trace.SessionLogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Authoritative combo state for one sorting session.
 *
 * <p>Consumes completed sort actions and produces immutable {@link ComboState} snapshots:
 * <pre>
 *   active &amp;&amp; 0 &lt;= now - lastActionAt &lt;= decayWindow  → count + 1
 *   otherwise                                       → count = 1
 * </pre>
 * A negative elapsed time (clock moved backwards) always restarts the streak, so a clock
 * anomaly can never extend a streak or produce a negative count. Accept and reject
 * gestures count the same.
 *
 * <h3>Threading</h3>
 * <p>Actions are expected from a single gesture pipeline, but every transition
 * ({@link #recordAction}, {@link #reset}, {@link #expire}, {@link #close}) takes this
 * object's monitor so a concurrent source still yields a strict total order. Snapshots
 * are published while the monitor is held; subscribers that do real work should
 * {@code publishOn} their own scheduler. {@link #currentState()} reads a volatile field
 * and never blocks.
 */
public class ComboTracker {

    private static final Logger log = LoggerFactory.getLogger(ComboTracker.class);

    private final String          sessionId;
    private final LevelClassifier classifier;
    private final Duration        decayWindow;
    private final Clock           clock;

    private final Sinks.Many<ComboState> sink = Sinks.many().replay().latest();

    private volatile ComboState state = ComboState.initial();
    private boolean closed;

    public ComboTracker(String sessionId, LevelClassifier classifier, Duration decayWindow, Clock clock) {
        if (decayWindow == null || decayWindow.isZero() || decayWindow.isNegative()) {
            throw new ComboConfigurationException("combo.decay-window-ms",
                "decay window must be positive but was " + decayWindow);
        }
        if (classifier == null) {
            throw new ComboConfigurationException("combo.thresholds", "classifier must not be null");
        }
        this.sessionId   = sessionId;
        this.classifier  = classifier;
        this.decayWindow = decayWindow;
        this.clock       = Objects.requireNonNull(clock, "clock");
        sink.tryEmitNext(state);
    }

    // ── Transitions ────────────────────────────────────────────────

    /** Records one completed sort action at the session clock's current instant. */
    public synchronized ComboState recordAction() {
        return recordAction(clock.instant());
    }

    /**
     * Records one completed sort action.
     *
     * @param now when the gesture completed
     * @return the new authoritative state (already published)
     * @throws IllegalStateException if the session has been closed
     */
    public synchronized ComboState recordAction(Instant now) {
        ensureOpen();
        ComboState current = state;
        int count = continuesStreak(current, now) ? current.count() + 1 : 1;
        ComboLevel level = classifier.classify(count);
        ComboState next = ComboState.live(count, level, now, current.maxCount());

        if (level.compareTo(current.level()) > 0 && level.isAtLeast(ComboLevel.WARM)) {
            SessionLogContext.withMdc(sessionId, () ->
                log.info("COMBO_LEVEL_UP sessionId={} level={} count={}", sessionId, level, count));
        } else {
            log.debug("COMBO_ACTION sessionId={} count={} level={}", sessionId, count, level);
        }
        return publish(next);
    }

    /** Resets the streak at the session clock's current instant. */
    public synchronized ComboState reset() {
        return reset(clock.instant());
    }

    /**
     * Forces {@code {0, NONE, inactive}} keeping the session best. Calling it on a state
     * that is already reset returns that snapshot unchanged and publishes nothing.
     *
     * @throws IllegalStateException if the session has been closed
     */
    public synchronized ComboState reset(Instant now) {
        ensureOpen();
        ComboState current = state;
        if (current.isIdle()) {
            return current;
        }
        log.debug("COMBO_RESET sessionId={} count={} maxCount={}", sessionId, current.count(), current.maxCount());
        return publish(ComboState.idle(now, current.maxCount()));
    }

    /**
     * Decay entry point. Resets only if {@code armedFor} is still the authoritative
     * snapshot; a timer armed for a state that has since been replaced is a no-op.
     *
     * @return true if the streak was reset by this call
     */
    public synchronized boolean expire(ComboState armedFor) {
        if (closed || state != armedFor || !armedFor.active()) {
            return false;
        }
        SessionLogContext.withMdc(sessionId, () ->
            log.info("COMBO_DECAYED sessionId={} count={} level={} idleFor={}ms",
                     sessionId, armedFor.count(), armedFor.level(), decayWindow.toMillis()));
        publish(ComboState.idle(clock.instant(), armedFor.maxCount()));
        return true;
    }

    /**
     * Ends the session: completes {@link #states()} and rejects further transitions.
     * {@link #currentState()} keeps returning the last snapshot. Idempotent.
     */
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        sink.tryEmitComplete();
    }

    // ── Reads ──────────────────────────────────────────────────────

    /** Latest completed snapshot. Lock-free. */
    public ComboState currentState() {
        return state;
    }

    /**
     * Push view of the state: replays the latest snapshot to each new subscriber, then
     * every later transition in order. Completes when the session closes.
     */
    public Flux<ComboState> states() {
        return sink.asFlux();
    }

    public String sessionId()        { return sessionId; }
    public Duration decayWindow()    { return decayWindow; }
    public Clock clock()             { return clock; }
    public LevelClassifier classifier() { return classifier; }

    public synchronized boolean isClosed() {
        return closed;
    }

    // ── Internals ──────────────────────────────────────────────────

    private boolean continuesStreak(ComboState current, Instant now) {
        if (!current.active()) {
            return false;
        }
        Duration elapsed = Duration.between(current.lastActionAt(), now);
        if (elapsed.isNegative()) {
            SessionLogContext.withMdc(sessionId, () ->
                log.warn("COMBO_CLOCK_ANOMALY sessionId={} lastActionAt={} now={}, restarting streak",
                         sessionId, current.lastActionAt(), now));
            return false;
        }
        return elapsed.compareTo(decayWindow) <= 0;
    }

    private ComboState publish(ComboState next) {
        state = next;
        Sinks.EmitResult result = sink.tryEmitNext(next);
        if (result.isFailure()) {
            log.warn("COMBO_PUBLISH_FAILED sessionId={} result={}", sessionId, result);
        }
        return next;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Combo session closed. sessionId=" + sessionId);
        }
    }
}
