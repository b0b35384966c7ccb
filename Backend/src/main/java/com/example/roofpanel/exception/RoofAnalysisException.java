package com.example.roofpanel.exception;

/**
 * 지붕 분석 중 발생하는 예외의 기본 타입
 */
public class RoofAnalysisException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public RoofAnalysisException(String message) {
        super(message);
    }

    public RoofAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
