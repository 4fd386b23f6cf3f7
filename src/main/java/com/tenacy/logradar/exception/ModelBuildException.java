package com.tenacy.logradar.exception;

/**
 * 학습 표본이 부족하거나 퇴화된 경우 발생. 이전 모델이 계속 사용된다.
 */
public class ModelBuildException extends RuntimeException {

    public ModelBuildException(String message) {
        super(message);
    }
}
