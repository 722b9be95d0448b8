package com.swipecombo.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Immutable snapshot of one session's combo streak.
 *
 * <p>Snapshots are replaced, never mutated: the tracker swaps the whole record on each
 * transition so readers never see a half-applied update. {@code level} is always the
 * classifier's projection of {@code count}; this record cannot check that (it does not
 * know the table) but it does reject the combinations no table can produce.
 *
 * @param count        actions in the current unbroken streak (≥ 0)
 * @param level        tier derived from {@code count}
 * @param active       true while the streak is live
 * @param lastActionAt most recent contributing action, or the reset instant
 * @param maxCount     best streak reached in this session (≥ {@code count})
 */
public record ComboState(
    @JsonProperty("count")        int        count,
    @JsonProperty("level")        ComboLevel level,
    @JsonProperty("active")       boolean    active,
    @JsonProperty("lastActionAt") Instant    lastActionAt,
    @JsonProperty("maxCount")     int        maxCount
) {

    public ComboState {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0 but was " + count);
        }
        if (level == null) {
            throw new IllegalArgumentException("level must not be null");
        }
        if (lastActionAt == null) {
            throw new IllegalArgumentException("lastActionAt must not be null");
        }
        if (count == 0 && (level != ComboLevel.NONE || active)) {
            throw new IllegalArgumentException(
                "empty streak must be NONE and inactive but was level=" + level + " active=" + active);
        }
        if (maxCount < count) {
            throw new IllegalArgumentException(
                "maxCount " + maxCount + " is below count " + count);
        }
    }

    /** State of a freshly opened session: {@code {0, NONE, false, EPOCH}}. */
    public static ComboState initial() {
        return new ComboState(0, ComboLevel.NONE, false, Instant.EPOCH, 0);
    }

    /** Reset state at {@code at}, carrying the session best forward. */
    public static ComboState idle(Instant at, int maxCount) {
        return new ComboState(0, ComboLevel.NONE, false, at, maxCount);
    }

    /** Live streak of {@code count} actions, last one at {@code at}. */
    public static ComboState live(int count, ComboLevel level, Instant at, int previousMax) {
        return new ComboState(count, level, true, at, Math.max(previousMax, count));
    }

    /** True for the reset shape {@code {0, NONE, false}}, whatever the timestamp. */
    @JsonIgnore
    public boolean isIdle() {
        return count == 0 && !active;
    }
}
