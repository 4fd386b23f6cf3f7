package com.tenacy.logradar.explanation;

public interface ExplanationClient {

    boolean isEnabled();

    /**
     * @return 설명 본문
     * @throws com.tenacy.logradar.exception.TransientIOException 호출 실패
     */
    String explain(ExplanationRequest request);
}
