package com.swipecombo.service.config;

import com.swipecombo.common.classifier.LevelClassifier;
import com.swipecombo.common.exception.ComboConfigurationException;

import java.time.Duration;

/**
 * Construction-time settings shared by every session: the idle window and the level table.
 */
public record ComboSettings(
    Duration        decayWindow,
    LevelClassifier classifier
) {

    public ComboSettings {
        if (decayWindow == null || decayWindow.isZero() || decayWindow.isNegative()) {
            throw new ComboConfigurationException("combo.decay-window-ms",
                "decay window must be positive but was " + decayWindow);
        }
        if (classifier == null) {
            throw new ComboConfigurationException("combo.thresholds", "classifier must not be null");
        }
    }
}
