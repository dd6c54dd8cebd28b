package com.todoinsight.monitoring;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Objects;

/**
 * 类说明 / Class Description:
 * 中文：API 请求计数过滤器，对路径以 API 前缀开头的请求按 HTTP 方法累加计数，发生在路由之前，与处理结果无关。
 * English: API request counter filter incrementing a per-HTTP-method counter for every request whose path
 * starts with the API prefix, ahead of routing and regardless of the outcome.
 *
 * 设计目的 / Design Purpose:
 * 中文：Prometheus 中的指标名为 http_requests_api_total，标签 method。
 * English: Rendered in Prometheus as http_requests_api_total with a method label.
 */
public class ApiRequestCounterFilter extends OncePerRequestFilter {

    public static final String METRIC_NAME = "http.requests.api";

    private final MeterRegistry meterRegistry;
    private final String apiPrefix;

    /**
     * @param meterRegistry Micrometer 指标注册表
     * @param apiPrefix     需要计数的路径前缀，例如 /api
     */
    public ApiRequestCounterFilter(MeterRegistry meterRegistry, String apiPrefix) {
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
        this.apiPrefix = Objects.requireNonNull(apiPrefix, "apiPrefix must not be null");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        if (pathWithinApplication(request).startsWith(apiPrefix)) {
            Counter.builder(METRIC_NAME)
                    .description("Number of API requests by HTTP method")
                    .tag("method", request.getMethod())
                    .register(meterRegistry)
                    .increment();
        }
        chain.doFilter(request, response);
    }

    private static String pathWithinApplication(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String contextPath = request.getContextPath();
        if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
            return uri.substring(contextPath.length());
        }
        return uri;
    }
}
