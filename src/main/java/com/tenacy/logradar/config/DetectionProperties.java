package com.tenacy.logradar.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@ConfigurationProperties(prefix = "logradar.detection")
public class DetectionProperties {

    /** 특성 추출 윈도우 길이. */
    @NotNull private Duration windowSize = Duration.ofSeconds(60);

    /** 버퍼 보존 구간. 이보다 오래된 이벤트는 버려진다. */
    @NotNull private Duration retentionHorizon = Duration.ofMinutes(10);

    /** 탐지 주기. {@link SchedulingConfig}가 이 값으로 작업을 등록한다. */
    @NotNull private Duration tickPeriod = Duration.ofSeconds(5);

    /** 한 주기의 소프트 데드라인. 넘기면 다음 주기를 건너뛴다. */
    @NotNull private Duration tickDeadline = Duration.ofSeconds(4);

    /** 이 기간 동안 이벤트가 없으면 stale 서비스로 표시한다. */
    @NotNull private Duration staleAfter = Duration.ofMinutes(5);

    /** 서비스의 최신 이벤트보다 이만큼 이상 과거인 이벤트는 순서 위반으로 거부한다. */
    @NotNull private Duration outOfOrderTolerance = Duration.ofSeconds(30);

    /** 현재 시각보다 이만큼 이상 미래인 이벤트는 거부한다. */
    @NotNull private Duration maxClockSkew = Duration.ofSeconds(30);

    /** 서비스별 버퍼 상한. 초과 시 가장 오래된 이벤트부터 제거한다. */
    @Min(1) private int maxEventsPerService = 50_000;

    @Valid private Statistical statistical = new Statistical();
    @Valid private Pattern pattern = new Pattern();
    @Valid private ServiceRate serviceRate = new ServiceRate();
    @Valid private Health health = new Health();

    @AssertTrue(message = "window-size must be positive and not longer than retention-horizon")
    public boolean isWindowWithinHorizon() {
        return windowSize != null && retentionHorizon != null
                && !windowSize.isNegative() && !windowSize.isZero()
                && windowSize.compareTo(retentionHorizon) <= 0;
    }

    @AssertTrue(message = "tick-period and tick-deadline must be positive")
    public boolean isTickTimingValid() {
        return tickPeriod != null && tickDeadline != null
                && !tickPeriod.isNegative() && !tickPeriod.isZero()
                && !tickDeadline.isNegative() && !tickDeadline.isZero();
    }

    @Data
    public static class Statistical {
        /** |x - m| / sqrt(v + epsilon) 가 이 값을 넘으면 플래그. */
        @Positive private double zScoreThreshold = 3.0;

        /** 콜드 베이스라인에서 0 나눗셈을 막는 값. */
        @Positive private double epsilon = 1e-4;

        /** (서비스, 지표)별로 이만큼 관측하기 전에는 플래그를 내지 않는다. */
        @PositiveOrZero private int warmupCount = 10;

        /**
         * EWMA 감쇠 계수. (0, 1) 범위.
         * 같은 크기의 이탈이 바로 다음 윈도우에 반복되면 z = (1 - alpha) / sqrt(alpha) 이므로
         * 이 값이 zScoreThreshold보다 커야 반복이 다시 플래그된다.
         */
        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax(value = "1.0", inclusive = false)
        private double alpha = 0.05;

        /**
         * 직전 윈도우와 같은 크기의 이탈이 반복될 때의 z-score.
         */
        public double repeatedDeviationZScore() {
            return (1 - alpha) / Math.sqrt(alpha);
        }
    }

    @Data
    public static class Pattern {
        /** 이상 점수가 이 값을 넘으면 PATTERN_ANOMALY 플래그. */
        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax(value = "1.0", inclusive = false)
        private double anomalyThreshold = 0.65;

        /** 포레스트 트리 개수 T. */
        @Min(1) private int treeCount = 100;

        /** 트리당 부분 표본 크기 s. */
        @Min(2) private int subsampleSize = 256;

        /** 서비스별 롤링 표본 버퍼 크기 N. */
        @Min(2) private int sampleCapacity = 1024;

        /** 재학습에 필요한 최소 표본 수. */
        @Min(2) private int minTrainingSamples = 32;

        /** 재학습 주기. {@link SchedulingConfig}가 이 값으로 작업을 등록한다. */
        @NotNull private Duration retrainPeriod = Duration.ofMinutes(1);

        /** 재현 가능한 학습이 필요할 때 지정하는 난수 시드. */
        private Long seed;

        @AssertTrue(message = "subsample-size must not exceed sample-capacity")
        public boolean isSubsampleWithinCapacity() {
            return subsampleSize <= sampleCapacity;
        }

        @AssertTrue(message = "min-training-samples must not exceed sample-capacity")
        public boolean isMinTrainingWithinCapacity() {
            return minTrainingSamples <= sampleCapacity;
        }
    }

    @Data
    public static class ServiceRate {
        /** 서비스 ERROR 비율 임계값. */
        @DecimalMin("0.0") @DecimalMax("1.0") private double errorRateThreshold = 0.3;

        /** 서비스 CRITICAL 비율 임계값. */
        @DecimalMin("0.0") @DecimalMax("1.0") private double criticalRateThreshold = 0.1;

        /** 비율을 판단하기 위한 윈도우 내 최소 이벤트 수. */
        @Min(1) private int minEvents = 5;
    }

    @Data
    public static class Health {
        @PositiveOrZero private double errorWeight = 100.0;
        @PositiveOrZero private double criticalWeight = 100.0;
        @PositiveOrZero private double anomalyWeight = 20.0;

        /** 추세 표시용 시스템 헬스 이력 길이. */
        @Min(1) private int historySize = 120;
    }
}
