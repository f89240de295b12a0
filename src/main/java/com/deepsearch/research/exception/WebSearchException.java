package com.deepsearch.research.exception;

/**
 * 웹 검색 단계의 예상치 못한 실패. 실행 전체가 실패한다.
 */
public class WebSearchException extends DeepSearchException {

    public WebSearchException(String message, Throwable cause) {
        super("WEB_SEARCH_ERROR", message, null, cause);
    }

    public static WebSearchException retrievalFailed(Throwable cause) {
        return new WebSearchException("Web search failed: " + cause.getMessage(), cause);
    }
}
