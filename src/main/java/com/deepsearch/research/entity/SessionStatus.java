package com.deepsearch.research.entity;

/**
 * Persisted lifecycle of a research session.
 */
public enum SessionStatus {
    PENDING,
    COMPLETED,
    ERROR
}
