package com.tenacy.logradar.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MetricsConfig {

    @Bean
    public Counter ingestedEventsCounter(MeterRegistry registry) {
        return Counter.builder("logradar.events.ingested")
                .description("버퍼에 적재된 로그 수")
                .register(registry);
    }

    @Bean
    public Counter rejectedEventsCounter(MeterRegistry registry) {
        return Counter.builder("logradar.events.rejected")
                .description("품질 문제로 거부된 로그 수")
                .register(registry);
    }

    @Bean
    public Counter debugLogsCounter(MeterRegistry registry) {
        return Counter.builder("logradar.logs.debug")
                .description("디버그 로그 수")
                .register(registry);
    }

    @Bean
    public Counter infoLogsCounter(MeterRegistry registry) {
        return Counter.builder("logradar.logs.info")
                .description("정보 로그 수")
                .register(registry);
    }

    @Bean
    public Counter warnLogsCounter(MeterRegistry registry) {
        return Counter.builder("logradar.logs.warn")
                .description("경고 로그 수")
                .register(registry);
    }

    @Bean
    public Counter errorLogsCounter(MeterRegistry registry) {
        return Counter.builder("logradar.logs.error")
                .description("에러 로그 수")
                .register(registry);
    }

    @Bean
    public Counter criticalLogsCounter(MeterRegistry registry) {
        return Counter.builder("logradar.logs.critical")
                .description("치명 로그 수")
                .register(registry);
    }
}
