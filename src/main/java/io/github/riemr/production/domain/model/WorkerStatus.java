package io.github.riemr.production.domain.model;

public enum WorkerStatus {
    ACTIVE,
    INACTIVE,
    ON_LEAVE
}
