package io.github.riemr.production.planning.analysis;

import lombok.Value;

import java.time.LocalDate;

@Value
public class WeeklyCapacity {
    LocalDate weekStart;
    LocalDate weekEnd;
    double requiredHours;
    double availableHours;
    double utilization;
}
