package com.tenacy.logradar.alert;

public enum AlertKind {
    VOLUME_SPIKE("로그량 급변"),
    SEVERITY_SHIFT("심각도 분포 변화"),
    PATTERN_ANOMALY("패턴 이상"),
    SERVICE_ERROR_RATE("서비스 오류율 초과");

    private final String displayName;

    AlertKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
