package io.github.riemr.production.planning.analysis;

import lombok.Value;

import java.time.LocalDate;

@Value
public class OvertimeProjection {
    LocalDate date;
    double requiredHours;
    double standardHours;
    double overtimeHours;
    int entryCount;
}
