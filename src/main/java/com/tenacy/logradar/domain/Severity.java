package com.tenacy.logradar.domain;

import java.util.Locale;

/**
 * 로그 심각도. 선언 순서가 곧 심각도 순서이다 (DEBUG < INFO < WARN < ERROR < CRITICAL).
 */
public enum Severity {
    DEBUG,
    INFO,
    WARN,
    ERROR,
    CRITICAL;

    /**
     * 문자열을 심각도로 변환한다. 대소문자를 구분하지 않으며 "WARNING"은 WARN으로 취급한다.
     *
     * @return 알 수 없는 값이면 null
     */
    public static Severity parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }

        String normalized = value.trim().toUpperCase(Locale.ROOT);
        switch (normalized) {
            case "DEBUG":
            case "TRACE":
                return DEBUG;
            case "INFO":
                return INFO;
            case "WARN":
            case "WARNING":
                return WARN;
            case "ERROR":
                return ERROR;
            case "CRITICAL":
            case "FATAL":
                return CRITICAL;
            default:
                return null;
        }
    }
}
