package com.tenacy.perfpulse.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MetricsConfig {

    public static final String SUMMARIES_WRITTEN = "perfpulse.summaries.written";
    public static final String AGGREGATION_FAILURES = "perfpulse.aggregation.failures";
    public static final String AGGREGATION_TIMER = "perfpulse.aggregation.duration";
    public static final String SAMPLES_INGESTED = "perfpulse.samples.ingested";

    @Bean
    public Counter summariesWrittenCounter(MeterRegistry registry) {
        return Counter.builder(SUMMARIES_WRITTEN)
                .description("저장된 요약 레코드 수")
                .register(registry);
    }

    @Bean
    public Counter aggregationFailuresCounter(MeterRegistry registry) {
        return Counter.builder(AGGREGATION_FAILURES)
                .description("실패한 구간 집계 수")
                .register(registry);
    }

    @Bean
    public Timer aggregationTimer(MeterRegistry registry) {
        return Timer.builder(AGGREGATION_TIMER)
                .description("구간 집계 소요 시간")
                .register(registry);
    }

    @Bean
    public Counter samplesIngestedCounter(MeterRegistry registry) {
        return Counter.builder(SAMPLES_INGESTED)
                .description("수집된 요청 샘플 수")
                .register(registry);
    }
}
