package com.deepsearch.research.exception;

/**
 * LLM 서버 통신 중 발생한 전송 또는 HTTP 오류
 */
public class AnalysisServiceException extends DeepSearchException {

    public AnalysisServiceException(String message) {
        super("ANALYSIS_SERVICE_ERROR", message);
    }

    public AnalysisServiceException(String message, Throwable cause) {
        super("ANALYSIS_SERVICE_ERROR", message, null, cause);
    }

    /**
     * 모델 서버가 2xx 이외의 상태를 반환
     */
    public static AnalysisServiceException httpError(String endpoint, int status, String body) {
        return new AnalysisServiceException(
                String.format("Analysis service %s returned HTTP %d: %s", endpoint, status, body));
    }

    /**
     * 모델 서버 연결 실패 또는 응답 시간 초과
     */
    public static AnalysisServiceException callFailed(String endpoint, Throwable cause) {
        return new AnalysisServiceException(
                "Analysis service call failed: " + endpoint + " - " + cause.getMessage(), cause);
    }

    /**
     * 사용할 수 있는 응답 내용이 없음
     */
    public static AnalysisServiceException emptyResponse(String endpoint) {
        return new AnalysisServiceException("Analysis service returned an empty response: " + endpoint);
    }
}
