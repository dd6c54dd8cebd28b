package com.todoinsight.monitoring;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * 基于 AOP 的持久化指标采集切面，自动统计本项目内 @Transactional 操作的执行耗时。
 */
@Aspect
@Component
public class PersistenceMetricsAspect {

    public static final String METRIC_NAME = "todo.persistence.duration";

    private final MeterRegistry meterRegistry;

    /**
     * @param meterRegistry Micrometer 指标注册表
     */
    public PersistenceMetricsAspect(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * 拦截本项目内方法级或类级 @Transactional 的调用并记录耗时，指标名为 todo.persistence.duration。
     */
    @Around("within(com.todoinsight..*) && "
            + "(@annotation(org.springframework.transaction.annotation.Transactional) "
            + "|| @within(org.springframework.transaction.annotation.Transactional))")
    public Object measurePersistenceTime(ProceedingJoinPoint pjp) throws Throwable {
        long start = System.nanoTime();
        try {
            return pjp.proceed();
        } finally {
            long duration = System.nanoTime() - start;
            // 以方法签名作为 tag，区分不同的持久化操作
            Timer.builder(METRIC_NAME)
                    .description("Duration of persistence operations")
                    .tag("operation", pjp.getSignature().toShortString())
                    .register(meterRegistry)
                    .record(duration, TimeUnit.NANOSECONDS);
        }
    }
}
