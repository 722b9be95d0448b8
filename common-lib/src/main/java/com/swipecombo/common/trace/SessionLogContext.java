package com.swipecombo.common.trace;

import org.slf4j.MDC;

/**
 * Bridges a combo session id into MDC for the duration of a single log statement.
 *
 * <p>Combo sessions are driven from whatever thread delivers the gesture or fires the
 * decay timer, so the session id is never left behind in a ThreadLocal. Callers wrap the
 * log call:
 * <pre>
 *     SessionLogContext.withMdc(sessionId, () -&gt; log.info("COMBO_DECAYED sessionId={}", sessionId));
 * </pre>
 */
public final class SessionLogContext {

    public static final String SESSION_ID_KEY = "comboSession";

    private SessionLogContext() {}

    /**
     * Puts {@code sessionId} into MDC, runs {@code logAction}, then restores whatever
     * value the key held before. ONLY use this around logging side-effects.
     *
     * @param sessionId the combo session id to expose to the log pattern
     * @param logAction the log statement to execute with MDC populated
     */
    public static void withMdc(String sessionId, Runnable logAction) {
        String previous = MDC.get(SESSION_ID_KEY);
        MDC.put(SESSION_ID_KEY, sessionId);
        try {
            logAction.run();
        } finally {
            if (previous == null) {
                MDC.remove(SESSION_ID_KEY);
            } else {
                MDC.put(SESSION_ID_KEY, previous);
            }
        }
    }
}
