package com.deepsearch.research.exception;

/**
 * 리포트 생성 실패. 실행 전체가 실패한다.
 */
public class ReportGenerationException extends DeepSearchException {

    public ReportGenerationException(String message, String sessionId, Throwable cause) {
        super("REPORT_GENERATION_ERROR", message, sessionId, cause);
    }

    public static ReportGenerationException synthesisFailed(String query, String sessionId, Throwable cause) {
        return new ReportGenerationException(
                "Failed to generate report for query '" + query + "': " + cause.getMessage(), sessionId, cause);
    }
}
