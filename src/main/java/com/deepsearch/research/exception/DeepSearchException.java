package com.deepsearch.research.exception;

/**
 * 딥 서치 파이프라인 예외의 기본 클래스
 */
public class DeepSearchException extends RuntimeException {

    private final String errorCode;
    private final String sessionId;

    public DeepSearchException(String message) {
        super(message);
        this.errorCode = "DEEP_SEARCH_ERROR";
        this.sessionId = null;
    }

    public DeepSearchException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = "DEEP_SEARCH_ERROR";
        this.sessionId = null;
    }

    public DeepSearchException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
        this.sessionId = null;
    }

    public DeepSearchException(String errorCode, String message, String sessionId) {
        super(message);
        this.errorCode = errorCode;
        this.sessionId = sessionId;
    }

    public DeepSearchException(String errorCode, String message, String sessionId, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.sessionId = sessionId;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getSessionId() {
        return sessionId;
    }
}
