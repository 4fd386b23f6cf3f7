package com.tenacy.logradar.config;

import com.tenacy.logradar.detection.isolation.ModelRetrainingScheduler;
import com.tenacy.logradar.engine.DetectionOrchestrator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;
import org.springframework.scheduling.config.IntervalTask;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class SchedulingConfigTest {

    private DetectionProperties bind(Map<String, String> source) {
        Binder binder = new Binder(new MapConfigurationPropertySource(source));
        return binder.bind("logradar.detection", DetectionProperties.class).orElseGet(DetectionProperties::new);
    }

    @Test
    @DisplayName("5s, 1m 같은 짧은 표기로도 주기 작업이 등록됨")
    void configureTasks_ShortDurationForm_ShouldRegisterBoundPeriods() {
        // given
        DetectionProperties properties = bind(Map.of(
                "logradar.detection.tick-period", "5s",
                "logradar.detection.pattern.retrain-period", "1m"));
        DetectionOrchestrator orchestrator = mock(DetectionOrchestrator.class);
        ModelRetrainingScheduler retrainingScheduler = mock(ModelRetrainingScheduler.class);
        ScheduledTaskRegistrar registrar = new ScheduledTaskRegistrar();

        // when
        new SchedulingConfig(properties, orchestrator, retrainingScheduler).configureTasks(registrar);

        // then
        assertThat(registrar.getFixedRateTaskList()).hasSize(1);
        IntervalTask tick = registrar.getFixedRateTaskList().get(0);
        assertThat(tick.getIntervalDuration()).isEqualTo(Duration.ofSeconds(5));
        assertThat(tick.getInitialDelayDuration()).isEqualTo(Duration.ofSeconds(5));

        assertThat(registrar.getFixedDelayTaskList()).hasSize(1);
        IntervalTask retrain = registrar.getFixedDelayTaskList().get(0);
        assertThat(retrain.getIntervalDuration()).isEqualTo(Duration.ofMinutes(1));

        tick.getRunnable().run();
        retrain.getRunnable().run();
        verify(orchestrator).scheduledTick();
        verify(retrainingScheduler).retrainModels();
    }

    @Test
    @DisplayName("ISO-8601 표기도 같은 값으로 바인딩됨")
    void bind_IsoDurationForm_ShouldMatchShortForm() {
        DetectionProperties iso = bind(Map.of("logradar.detection.tick-period", "PT5S"));
        DetectionProperties simple = bind(Map.of("logradar.detection.tick-period", "5s"));

        assertThat(iso.getTickPeriod()).isEqualTo(simple.getTickPeriod()).isEqualTo(Duration.ofSeconds(5));
    }
}
