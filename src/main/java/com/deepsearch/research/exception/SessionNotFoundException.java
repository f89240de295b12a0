package com.deepsearch.research.exception;

import java.util.UUID;

public class SessionNotFoundException extends DeepSearchException {

    public SessionNotFoundException(String message, String sessionId) {
        super("SESSION_NOT_FOUND", message, sessionId);
    }

    public static SessionNotFoundException of(UUID sessionId) {
        return new SessionNotFoundException("Session not found: " + sessionId, String.valueOf(sessionId));
    }
}
