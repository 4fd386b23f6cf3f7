package com.tenacy.logradar.exception;

/**
 * 필수 필드 누락, 보존 구간 밖의 시각, 순서가 크게 어긋난 이벤트 등 품질 문제로 거부된 로그.
 */
public class DataQualityException extends RuntimeException {

    private final String service;

    public DataQualityException(String service, String message) {
        super(message);
        this.service = service;
    }

    public String getService() {
        return service;
    }
}
