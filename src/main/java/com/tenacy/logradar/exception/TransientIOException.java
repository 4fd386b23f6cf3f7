package com.tenacy.logradar.exception;

/**
 * 알림 채널이나 AI 설명 서비스 호출의 일시적 실패. 재시도 대상이다.
 */
public class TransientIOException extends RuntimeException {

    public TransientIOException(String message) {
        super(message);
    }

    public TransientIOException(String message, Throwable cause) {
        super(message, cause);
    }
}
