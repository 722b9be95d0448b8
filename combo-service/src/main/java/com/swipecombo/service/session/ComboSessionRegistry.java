package com.swipecombo.service.session;

import com.swipecombo.common.trace.SessionLogContext;
import com.swipecombo.service.config.ComboSettings;
import com.swipecombo.service.tracker.ComboTracker;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the live {@link ComboSession}s, one per sorting session id.
 *
 * <p>Opening an id that is already live disposes the old session first: a new sorting
 * session never inherits a streak or a pending decay from the previous one. Thread-safe
 * via {@link ConcurrentHashMap}; no method blocks.
 */
@Component
public class ComboSessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ComboSessionRegistry.class);

    private final ComboSettings settings;
    private final Scheduler     timer;
    private final Clock         clock;

    private final ConcurrentHashMap<String, ComboSession> sessions = new ConcurrentHashMap<>();

    public ComboSessionRegistry(ComboSettings settings,
                                @Qualifier("comboDecayScheduler") Scheduler timer,
                                @Qualifier("comboClock") Clock clock) {
        this.settings = settings;
        this.timer    = timer;
        this.clock    = clock;
    }

    /** Opens a session under a fresh random id. */
    public ComboSession open() {
        return open(UUID.randomUUID().toString());
    }

    /**
     * Opens a session under {@code sessionId}, replacing (and disposing) any live session
     * with the same id.
     */
    public ComboSession open(String sessionId) {
        ComboTracker tracker = new ComboTracker(sessionId, settings.classifier(), settings.decayWindow(), clock);
        ComboSession session = new ComboSession(tracker, timer);

        ComboSession previous = sessions.put(sessionId, session);
        if (previous != null) {
            previous.dispose();
            SessionLogContext.withMdc(sessionId, () ->
                log.info("COMBO_SESSION_REPLACED sessionId={} previousMaxCount={}",
                         sessionId, previous.currentState().maxCount()));
        }
        SessionLogContext.withMdc(sessionId, () ->
            log.info("COMBO_SESSION_OPENED sessionId={} decayWindowMs={}",
                     sessionId, settings.decayWindow().toMillis()));
        return session;
    }

    public Optional<ComboSession> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    /**
     * Disposes and forgets the session.
     *
     * @return false if no live session had that id
     */
    public boolean close(String sessionId) {
        ComboSession session = sessions.remove(sessionId);
        if (session == null) {
            return false;
        }
        session.dispose();
        SessionLogContext.withMdc(sessionId, () ->
            log.info("COMBO_SESSION_CLOSED sessionId={} maxCount={}",
                     sessionId, session.currentState().maxCount()));
        return true;
    }

    public int activeSessionCount() {
        return sessions.size();
    }

    @PreDestroy
    public void closeAll() {
        log.info("Closing all combo sessions. count={}", sessions.size());
        sessions.keySet().forEach(this::close);
    }
}
