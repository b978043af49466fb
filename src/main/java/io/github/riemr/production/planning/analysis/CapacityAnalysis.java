package io.github.riemr.production.planning.analysis;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CapacityAnalysis {
    List<WeeklyCapacity> weeks;
    /** スケジュール未作成の受注の必要工数 */
    double unscheduledHours;
    double totalRequiredHours;
    double totalAvailableHours;
    /** 100 を超えうる */
    double utilization;
}
