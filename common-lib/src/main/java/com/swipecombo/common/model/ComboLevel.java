package com.swipecombo.common.model;

/**
 * Discrete escalation tier of a sorting streak, used only to pick feedback intensity.
 *
 * <p>Declaration order is the escalation order: {@code NONE < NORMAL < WARM < HOT < FIRE}.
 * Code that compares levels must go through {@link #isAtLeast(ComboLevel)} or
 * {@link #compareTo(Enum)}, never through the names.
 *
 * <h3>Default tiers</h3>
 * <ul>
 *   <li>{@link #NONE}:   no streak (count 0).</li>
 *   <li>{@link #NORMAL}: x1–x4.</li>
 *   <li>{@link #WARM}:   x5–x9.</li>
 *   <li>{@link #HOT}:    x10–x19.</li>
 *   <li>{@link #FIRE}:   x20 and above.</li>
 * </ul>
 * The actual boundaries come from the session's {@code LevelClassifier}.
 */
public enum ComboLevel {

    /** No live streak. */
    NONE,

    /** Streak started. */
    NORMAL,

    /** Streak warming up. */
    WARM,

    /** Sustained streak. */
    HOT,

    /** Top tier. */
    FIRE;

    /** True if this level is the same as or above {@code other}. */
    public boolean isAtLeast(ComboLevel other) {
        return compareTo(other) >= 0;
    }
}
