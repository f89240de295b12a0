package com.deepsearch.research.service;

/**
 * 리서치 실행의 진행 단계 (메모리 내). ERROR는 어느 단계에서든 도달할 수 있다.
 */
public enum ResearchStage {
    CREATED,
    TERMS_GENERATED,
    WEB_SEARCHED,
    ANALYZED,
    REPORTED,
    COMPLETED,
    ERROR;

    /**
     * Stage being worked on once this one is reached
     */
    public ResearchStage next() {
        return switch (this) {
            case CREATED -> TERMS_GENERATED;
            case TERMS_GENERATED -> WEB_SEARCHED;
            case WEB_SEARCHED -> ANALYZED;
            case ANALYZED -> REPORTED;
            case REPORTED -> COMPLETED;
            case COMPLETED, ERROR -> this;
        };
    }
}
