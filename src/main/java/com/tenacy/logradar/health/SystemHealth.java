package com.tenacy.logradar.health;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * 한 주기의 시스템 전체 헬스. contributingServices는 가중 평균에 들어간 서비스다.
 */
@Value
@Builder
public class SystemHealth {
    double score;
    Instant timestamp;
    List<String> contributingServices;
    List<String> staleServices;
}
