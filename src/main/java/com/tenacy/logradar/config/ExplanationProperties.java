package com.tenacy.logradar.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@ConfigurationProperties(prefix = "logradar.explanation")
public class ExplanationProperties {

    /** endpoint가 비어 있으면 설명 요청을 하지 않는다. */
    private boolean enabled = false;

    /** 설명 서비스 URL. 이상 정보를 POST 한다. */
    private String endpoint;

    /** Authorization 헤더에 Bearer로 실리는 키. */
    private String apiKey;

    @NotNull private Duration timeout = Duration.ofSeconds(10);

    @PositiveOrZero private int maxRetries = 2;

    @NotNull private Duration initialBackoff = Duration.ofSeconds(1);
}
