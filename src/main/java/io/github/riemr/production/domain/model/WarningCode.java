package io.github.riemr.production.domain.model;

public enum WarningCode {
    NO_ELIGIBLE_WORKER,
    EQUIPMENT_UNAVAILABLE,
    DEADLINE_EXCEEDED,
    IN_PROGRESS_ENTRY_REPLANNED
}
