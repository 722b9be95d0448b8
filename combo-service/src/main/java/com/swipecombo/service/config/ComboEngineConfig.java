package com.swipecombo.service.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.swipecombo.common.classifier.LevelClassifier;
import com.swipecombo.service.time.SchedulerClock;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class ComboEngineConfig {

    @Value("${combo.decay-window-ms:1500}")
    private long decayWindowMs;

    @Value("${combo.thresholds:0=NONE,1=NORMAL,5=WARM,10=HOT,20=FIRE}")
    private String thresholds;

    @Bean
    public LevelClassifier levelClassifier() {
        return LevelClassifier.parse(thresholds);
    }

    @Bean
    public ComboSettings comboSettings(LevelClassifier levelClassifier) {
        return new ComboSettings(Duration.ofMillis(decayWindowMs), levelClassifier);
    }

    @Bean(destroyMethod = "dispose")
    public Scheduler comboDecayScheduler() {
        return Schedulers.newSingle("combo-decay");
    }

    @Bean
    public Clock comboClock(@Qualifier("comboDecayScheduler") Scheduler comboDecayScheduler) {
        return new SchedulerClock(comboDecayScheduler);
    }

    /** Mapper for handing {@code ComboState} snapshots to a rendering bridge as JSON. */
    @Bean
    public ObjectMapper comboObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
