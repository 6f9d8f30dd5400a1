package com.adinsight.anomaly.config;

import io.micrometer.observation.ObservationRegistry;
import io.micrometer.observation.aop.ObservedAspect;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class EngineConfig {

    @Bean
    public Clock clock(ScheduleConfig scheduleConfig) {
        return Clock.system(ZoneId.of(scheduleConfig.getZone()));
    }

    // Enables @Observed on the detector, analyzer and dispatcher entry points
    @Bean
    public ObservedAspect observedAspect(ObservationRegistry observationRegistry) {
        return new ObservedAspect(observationRegistry);
    }

    @Bean(name = "detectionExecutor", destroyMethod = "shutdown")
    public ExecutorService detectionExecutor(DetectionConfig detectionConfig) {
        return Executors.newFixedThreadPool(Math.max(1, detectionConfig.getParallelism()));
    }

    @Bean(name = "alertSendExecutor", destroyMethod = "shutdown")
    public ExecutorService alertSendExecutor(AlertConfig alertConfig) {
        return Executors.newFixedThreadPool(Math.max(1, alertConfig.getSendPoolSize()));
    }
}
