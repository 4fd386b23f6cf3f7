package com.tenacy.logradar.alert;

/**
 * 알림 심각도. 선언 순서로 비교하며 높은 쪽으로의 변화가 에스컬레이션이다.
 */
public enum AlertSeverity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL;

    public boolean isHigherThan(AlertSeverity other) {
        return other == null || this.ordinal() > other.ordinal();
    }

    public static AlertSeverity max(AlertSeverity a, AlertSeverity b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.ordinal() >= b.ordinal() ? a : b;
    }
}
