package com.tenacy.logradar.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@ConfigurationProperties(prefix = "logradar.alert")
public class AlertProperties {

    /** 같은 (서비스, 종류) 알림을 다시 보내지 않는 기간. */
    @NotNull private Duration cooldown = Duration.ofMinutes(5);

    /** 플래그가 이 횟수만큼 연속으로 없으면 QUIET으로 돌아간다. */
    @Min(1) private int decayCount = 3;

    /** 대시보드용 최근 알림 보관 개수. */
    @Min(1) private int recentHistorySize = 200;

    @Valid private Notification notification = new Notification();
    @Valid private Email email = new Email();

    @Data
    public static class Notification {
        /** 첫 시도 이후 재시도 횟수. */
        @PositiveOrZero private int maxRetries = 3;

        /** 첫 재시도 대기 시간. 이후 두 배씩 늘어난다. */
        @NotNull private Duration initialBackoff = Duration.ofSeconds(1);

        @NotNull private Duration maxBackoff = Duration.ofSeconds(30);
    }

    @Data
    public static class Email {
        private boolean enabled = false;
        private String sender;
        private String recipients;
    }
}
