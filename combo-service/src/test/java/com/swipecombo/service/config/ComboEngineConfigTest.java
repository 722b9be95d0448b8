package com.swipecombo.service.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.swipecombo.common.classifier.LevelClassifier;
import com.swipecombo.common.exception.ComboConfigurationException;
import com.swipecombo.common.model.ComboLevel;
import com.swipecombo.common.model.ComboState;
import com.swipecombo.service.session.ComboSessionRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ComboEngineConfigTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
        .withUserConfiguration(ComboEngineConfig.class, ComboSessionRegistry.class);

    @Test
    @DisplayName("defaults: 1500ms window and the 1/5/10/20 table")
    void defaults() {
        runner.run(ctx -> {
            assertThat(ctx).hasNotFailed();
            ComboSettings settings = ctx.getBean(ComboSettings.class);
            assertThat(settings.decayWindow()).isEqualTo(Duration.ofMillis(1500));
            assertThat(settings.classifier().thresholds())
                .isEqualTo(LevelClassifier.defaults().thresholds());
            assertThat(ctx).hasSingleBean(ComboSessionRegistry.class);
            assertThat(ctx).hasBean("comboDecayScheduler");
            assertThat(ctx.getBean("comboClock", Clock.class).instant()).isAfter(Instant.EPOCH);
        });
    }

    @Test
    @DisplayName("properties override window and thresholds")
    void overrides() {
        runner.withPropertyValues(
                "combo.decay-window-ms=2000",
                "combo.thresholds=0=NONE,1=NORMAL,3=HOT")
            .run(ctx -> {
                ComboSettings settings = ctx.getBean(ComboSettings.class);
                assertThat(settings.decayWindow()).isEqualTo(Duration.ofMillis(2000));
                assertThat(settings.classifier().classify(3)).isEqualTo(ComboLevel.HOT);
            });
    }

    @Test
    @DisplayName("non-monotonic threshold table stops the context from starting")
    void badThresholdsFailFast() {
        runner.withPropertyValues("combo.thresholds=0=NONE,5=WARM,3=NORMAL")
            .run(ctx -> {
                assertThat(ctx).hasFailed();
                assertThat(ctx.getStartupFailure()).hasRootCauseInstanceOf(ComboConfigurationException.class);
            });
    }

    @Test
    @DisplayName("non-positive decay window stops the context from starting")
    void badWindowFailsFast() {
        runner.withPropertyValues("combo.decay-window-ms=0")
            .run(ctx -> {
                assertThat(ctx).hasFailed();
                assertThat(ctx.getStartupFailure()).hasRootCauseInstanceOf(ComboConfigurationException.class);
            });
    }

    @Test
    @DisplayName("object mapper writes snapshots with ISO timestamps")
    void objectMapper() {
        runner.run(ctx -> {
            ObjectMapper mapper = ctx.getBean(ObjectMapper.class);
            String json = mapper.writeValueAsString(
                ComboState.live(10, ComboLevel.HOT, Instant.ofEpochMilli(0), 10));

            assertThat(json)
                .contains("\"level\":\"HOT\"")
                .contains("\"lastActionAt\":\"1970-01-01T00:00:00Z\"")
                .doesNotContain("idle");
        });
    }
}
