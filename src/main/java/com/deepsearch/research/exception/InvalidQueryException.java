package com.deepsearch.research.exception;

/**
 * 잘못된 입력. 작업 시작 전에 발생
 */
public class InvalidQueryException extends DeepSearchException {

    public InvalidQueryException(String message) {
        super("INVALID_QUERY", message);
    }

    public static InvalidQueryException blankQuery() {
        return new InvalidQueryException("Query must not be blank");
    }
}
