package io.github.riemr.production.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 計画作業の最小単位。1 工程 × 1 日 × 1 時間帯。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleEntry {
    private Long id;
    private Long scheduleId;
    private Long orderId;          // schedule との結合結果（非永続）
    private Long stepId;
    private LocalDate workDate;
    private LocalTime startTime;
    private LocalTime endTime;
    private Integer plannedOutput;
    private LocalTime actualStartTime;
    private LocalTime actualEndTime;
    private Integer actualOutput;
    @Builder.Default
    private EntryStatus status = EntryStatus.NOT_STARTED;
    private String notes;
    @Builder.Default
    private List<Assignment> assignments = new ArrayList<>();

    public boolean isCompleted() {
        return status == EntryStatus.COMPLETED;
    }

    public boolean isAssigned() {
        return assignments != null && !assignments.isEmpty();
    }

    public LocalDateTime plannedStart() {
        return workDate.atTime(startTime);
    }

    public LocalDateTime plannedEnd() {
        return workDate.atTime(endTime);
    }

    /** 実績完了時刻。未完了なら null。 */
    public LocalDateTime completedAt() {
        return actualEndTime == null ? null : workDate.atTime(actualEndTime);
    }

    public long plannedSeconds() {
        return Duration.between(startTime, endTime).getSeconds();
    }

    /** 実績の作業分数。開始・終了のいずれかが未記録なら 0。 */
    public double actualMinutes() {
        if (actualStartTime == null || actualEndTime == null) {
            return 0;
        }
        return Duration.between(actualStartTime, actualEndTime).getSeconds() / 60.0;
    }
}
