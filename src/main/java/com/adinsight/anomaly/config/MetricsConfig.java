package com.adinsight.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordAnomalyDetected(String metric, String severity, String method) {
        Counter.builder("anomaly.detected.count")
                .tag("metric", metric)
                .tag("severity", severity)
                .tag("method", method)
                .register(registry)
                .increment();
    }

    public void recordAnomalySuppressed(String metric) {
        Counter.builder("anomaly.suppressed.count")
                .tag("metric", metric)
                .register(registry)
                .increment();
    }

    public void recordAlertDispatch(String outcome) {
        Counter.builder("alert.dispatch.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordEvaluationRun(String status) {
        Counter.builder("evaluation.run.count")
                .tag("status", status)
                .register(registry)
                .increment();
    }
}
