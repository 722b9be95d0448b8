package com.swipecombo.common.classifier;

import com.swipecombo.common.exception.ComboConfigurationException;
import com.swipecombo.common.model.ComboLevel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Maps a streak length to a {@link ComboLevel} through a validated threshold table.
 *
 * <p>Instances are immutable and safe to share between sessions. All validation happens
 * in the constructor: a table that leaves a gap, repeats or reorders a boundary, or lets a
 * higher count map to a lower level is rejected with {@link ComboConfigurationException},
 * so {@link #classify(int)} never has to guess.
 *
 * <h3>Table rules</h3>
 * <ul>
 *   <li>The first row is {@code 0 → NONE} and the second row starts at {@code 1}:
 *       {@code NONE} means exactly "no streak".</li>
 *   <li>{@code minCount} is strictly increasing; each row covers
 *       {@code [minCount, next.minCount)} and the last row covers {@code [minCount, ∞)}.</li>
 *   <li>{@code level} is strictly increasing, which makes classification monotonic.</li>
 * </ul>
 *
 * <h3>Default table</h3>
 * <pre>
 *   0        NONE
 *   1 – 4    NORMAL
 *   5 – 9    WARM
 *   10 – 19  HOT
 *   20+      FIRE
 * </pre>
 *
 * <p>No Spring dependencies. No I/O.
 */
public final class LevelClassifier {

    static final String SETTING = "combo.thresholds";

    private static final LevelClassifier DEFAULTS = new LevelClassifier(List.of(
        LevelThreshold.of(0,  ComboLevel.NONE),
        LevelThreshold.of(1,  ComboLevel.NORMAL),
        LevelThreshold.of(5,  ComboLevel.WARM),
        LevelThreshold.of(10, ComboLevel.HOT),
        LevelThreshold.of(20, ComboLevel.FIRE)
    ));

    private final List<LevelThreshold> thresholds;

    public LevelClassifier(List<LevelThreshold> thresholds) {
        validate(thresholds);
        this.thresholds = List.copyOf(thresholds);
    }

    /** Classifier over the default {@code 1/5/10/20} table. */
    public static LevelClassifier defaults() {
        return DEFAULTS;
    }

    /**
     * Builds a classifier from its textual form, e.g.
     * {@code "0=NONE,1=NORMAL,5=WARM,10=HOT,20=FIRE"}. Whitespace around entries is ignored
     * and level names are case-insensitive.
     *
     * @throws ComboConfigurationException if an entry is malformed or the table is invalid
     */
    public static LevelClassifier parse(String spec) {
        if (spec == null || spec.isBlank()) {
            throw new ComboConfigurationException(SETTING, "threshold table must not be empty");
        }
        List<LevelThreshold> rows = new ArrayList<>();
        for (String raw : spec.split(",")) {
            String entry = raw.trim();
            int eq = entry.indexOf('=');
            if (eq <= 0 || eq == entry.length() - 1) {
                throw new ComboConfigurationException(SETTING,
                    "expected <minCount>=<LEVEL> but got '" + entry + "'");
            }
            String countPart = entry.substring(0, eq).trim();
            String levelPart = entry.substring(eq + 1).trim();

            int minCount;
            try {
                minCount = Integer.parseInt(countPart);
            } catch (NumberFormatException e) {
                throw new ComboConfigurationException(SETTING,
                    "minCount '" + countPart + "' is not an integer", e);
            }

            ComboLevel level;
            try {
                level = ComboLevel.valueOf(levelPart.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new ComboConfigurationException(SETTING,
                    "unknown level '" + levelPart + "'", e);
            }
            rows.add(LevelThreshold.of(minCount, level));
        }
        return new LevelClassifier(rows);
    }

    /**
     * Returns the level reached by a streak of {@code count} actions.
     *
     * @param count streak length, must be ≥ 0
     * @return the classified level; never null
     * @throws IllegalArgumentException if {@code count} is negative
     */
    public ComboLevel classify(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0 but was " + count);
        }
        for (int i = thresholds.size() - 1; i > 0; i--) {
            LevelThreshold row = thresholds.get(i);
            if (count >= row.minCount()) {
                return row.level();
            }
        }
        return thresholds.get(0).level();
    }

    /** Unmodifiable view of the validated table, lowest row first. */
    public List<LevelThreshold> thresholds() {
        return Collections.unmodifiableList(thresholds);
    }

    @Override
    public String toString() {
        return "LevelClassifier" + thresholds;
    }

    // ── Validation ─────────────────────────────────────────────────

    private static void validate(List<LevelThreshold> thresholds) {
        if (thresholds == null || thresholds.isEmpty()) {
            throw new ComboConfigurationException(SETTING, "threshold table must not be empty");
        }
        for (int i = 0; i < thresholds.size(); i++) {
            LevelThreshold row = thresholds.get(i);
            if (row == null || row.level() == null) {
                throw new ComboConfigurationException(SETTING, "row " + i + " is incomplete: " + row);
            }
            if (row.minCount() < 0) {
                throw new ComboConfigurationException(SETTING,
                    "row " + i + " has negative minCount " + row.minCount());
            }
        }

        LevelThreshold first = thresholds.get(0);
        if (first.minCount() != 0) {
            throw new ComboConfigurationException(SETTING,
                "table must start at 0 but starts at " + first.minCount());
        }
        if (first.level() != ComboLevel.NONE) {
            throw new ComboConfigurationException(SETTING,
                "count 0 must map to NONE but maps to " + first.level());
        }
        if (thresholds.size() < 2 || thresholds.get(1).minCount() != 1) {
            throw new ComboConfigurationException(SETTING,
                "NONE must cover exactly count 0; the next row has to start at 1");
        }

        for (int i = 1; i < thresholds.size(); i++) {
            LevelThreshold prev = thresholds.get(i - 1);
            LevelThreshold row  = thresholds.get(i);
            if (row.minCount() <= prev.minCount()) {
                throw new ComboConfigurationException(SETTING,
                    "minCount must be strictly increasing: " + prev + " then " + row);
            }
            if (row.level().compareTo(prev.level()) <= 0) {
                throw new ComboConfigurationException(SETTING,
                    "level must be strictly increasing: " + prev + " then " + row);
            }
        }
    }
}
