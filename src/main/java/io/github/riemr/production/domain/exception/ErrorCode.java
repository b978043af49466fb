package io.github.riemr.production.domain.exception;

public enum ErrorCode {
    INVALID_QUANTITY,
    INVALID_HORIZON,
    INVALID_TIME_WINDOW,
    INVALID_LEVEL,
    MALFORMED_STEP,
    NO_WORKING_DAYS,
    ORDER_COMPLETED,
    ENTRY_ALREADY_COMPLETED,
    CYCLE,
    DANGLING_DEPENDENCY,
    NOT_FOUND,
    CONCURRENCY_CONFLICT,
    PERSISTENCE_FAILURE,
    GENERATION_TIMEOUT
}
