package com.todoinsight.monitoring.web;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Renders every registered meter in the Prometheus text exposition format.
 * Without a Prometheus registry behind the injected one, {@code /metrics} answers 404.
 */
@Slf4j
@RestController
public class MetricsController {

    public static final String CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";

    private final PrometheusMeterRegistry prometheusMeterRegistry;

    public MetricsController(MeterRegistry meterRegistry) {
        this.prometheusMeterRegistry = findPrometheusRegistry(meterRegistry);
        if (prometheusMeterRegistry == null) {
            log.warn("No Prometheus registry behind {}, /metrics is disabled", meterRegistry.getClass().getSimpleName());
        }
    }

    @GetMapping(value = "/metrics", produces = CONTENT_TYPE)
    public ResponseEntity<String> metrics() {
        if (prometheusMeterRegistry == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(prometheusMeterRegistry.scrape());
    }

    static PrometheusMeterRegistry findPrometheusRegistry(MeterRegistry meterRegistry) {
        if (meterRegistry instanceof PrometheusMeterRegistry prometheus) {
            return prometheus;
        }
        if (meterRegistry instanceof CompositeMeterRegistry composite) {
            for (MeterRegistry child : composite.getRegistries()) {
                PrometheusMeterRegistry found = findPrometheusRegistry(child);
                if (found != null) {
                    return found;
                }
            }
        }
        return null;
    }
}
