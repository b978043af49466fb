package io.github.riemr.production.domain.model;

public enum StepCategory {
    CUTTING,
    SILKSCREEN,
    PREP,
    SEWING,
    INSPECTION
}
