package com.swipecombo.common.classifier;

import com.swipecombo.common.model.ComboLevel;

/**
 * One row of a level table: streaks of at least {@code minCount} actions reach {@code level},
 * up to the next row's {@code minCount}.
 */
public record LevelThreshold(
    int        minCount,
    ComboLevel level
) {

    public static LevelThreshold of(int minCount, ComboLevel level) {
        return new LevelThreshold(minCount, level);
    }

    @Override
    public String toString() {
        return minCount + "=" + level;
    }
}
