package io.github.riemr.production.application.dto;

import io.github.riemr.production.domain.model.ScheduleEntry;

import java.time.LocalDate;
import java.util.List;

/** 作業日ごとにまとめたスケジュール表示用 DTO。 */
public record ScheduleView(
    Long scheduleId,
    Long orderId,
    LocalDate startDate,
    List<Day> days
) {
    public record Day(
        LocalDate date,
        int plannedOutput,
        List<ScheduleEntry> entries
    ) {}
}
