package io.github.riemr.production.application.dto;

import java.util.List;

public record WorkerProductivity(
    Long workerId,
    String workerName,
    double totalHoursWorked,
    int totalUnitsProduced,
    long averageEfficiency,
    List<StepProductivity> stepBreakdown
) {}
