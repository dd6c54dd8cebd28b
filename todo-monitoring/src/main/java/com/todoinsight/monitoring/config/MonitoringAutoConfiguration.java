package com.todoinsight.monitoring.config;

import com.todoinsight.monitoring.ApiRequestCounterFilter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.ClassLoaderMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.core.instrument.binder.system.UptimeMetrics;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

/**
 * Provides the process-wide Prometheus registry and the API request counter filter without pulling
 * in the actuator stack. The registry is created once here and injected wherever metrics are recorded
 * or rendered.
 */
@Configuration
public class MonitoringAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public PrometheusMeterRegistry prometheusMeterRegistry() {
        PrometheusMeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        new ClassLoaderMetrics().bindTo(registry);
        new JvmMemoryMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);
        new UptimeMetrics().bindTo(registry);
        return registry;
    }

    // closed with the context, it holds GC notification listeners
    @Bean
    public JvmGcMetrics jvmGcMetrics(MeterRegistry meterRegistry) {
        JvmGcMetrics gcMetrics = new JvmGcMetrics();
        gcMetrics.bindTo(meterRegistry);
        return gcMetrics;
    }

    @Bean
    public FilterRegistrationBean<ApiRequestCounterFilter> apiRequestCounterFilter(
            MeterRegistry meterRegistry,
            @Value("${todo.metrics.api-prefix:/api}") String apiPrefix) {
        FilterRegistrationBean<ApiRequestCounterFilter> registration =
                new FilterRegistrationBean<>(new ApiRequestCounterFilter(meterRegistry, apiPrefix));
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE);
        registration.addUrlPatterns("/*");
        return registration;
    }
}
