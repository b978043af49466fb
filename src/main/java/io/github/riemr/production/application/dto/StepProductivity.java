package io.github.riemr.production.application.dto;

public record StepProductivity(
    Long stepId,
    String stepName,
    String category,
    int totalUnits,
    long totalMinutes,
    long averageEfficiency,
    int entryCount,
    int currentProficiency
) {}
