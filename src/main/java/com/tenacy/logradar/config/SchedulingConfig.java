package com.tenacy.logradar.config;

import com.tenacy.logradar.detection.isolation.ModelRetrainingScheduler;
import com.tenacy.logradar.engine.DetectionOrchestrator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.FixedDelayTask;
import org.springframework.scheduling.config.FixedRateTask;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

import java.time.Duration;

/**
 * 탐지 주기와 재학습 주기를 바인딩된 {@link DetectionProperties}의 Duration으로 등록한다.
 * 어노테이션 문자열 대신 바인딩 값을 쓰므로 {@code 5s}, {@code 1m} 같은 표기도 그대로 동작한다.
 */
@Slf4j
@Configuration
public class SchedulingConfig implements SchedulingConfigurer {

    private final DetectionProperties properties;
    private final DetectionOrchestrator detectionOrchestrator;
    private final ModelRetrainingScheduler retrainingScheduler;

    public SchedulingConfig(DetectionProperties properties,
                            DetectionOrchestrator detectionOrchestrator,
                            ModelRetrainingScheduler retrainingScheduler) {
        this.properties = properties;
        this.detectionOrchestrator = detectionOrchestrator;
        this.retrainingScheduler = retrainingScheduler;
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar taskRegistrar) {
        Duration tickPeriod = properties.getTickPeriod();
        Duration retrainPeriod = properties.getPattern().getRetrainPeriod();

        // 이전 주기가 길어져도 다음 주기는 고정 간격으로 시작한다. 겹침은 오케스트레이터가 건너뛴다.
        taskRegistrar.addFixedRateTask(new FixedRateTask(detectionOrchestrator::scheduledTick, tickPeriod, tickPeriod));
        taskRegistrar.addFixedDelayTask(new FixedDelayTask(retrainingScheduler::retrainModels, retrainPeriod, retrainPeriod));

        log.info("Scheduled detection every {} and model retraining every {}", tickPeriod, retrainPeriod);
    }
}
