package io.github.riemr.production.application.dto;

import io.github.riemr.production.domain.model.ScheduleEntry;
import io.github.riemr.production.domain.model.ScheduleWarning;

import java.time.LocalDate;
import java.util.List;

/**
 * 保存前の再計画案。エントリの id は未採番。
 *
 * @param sourceScheduleId 置き換え対象のスケジュール
 * @param completedOutput  全工程を完了した数量
 * @param canMeetDeadline  納期超過の警告がなければ true
 */
public record ReplanDraft(
    Long sourceScheduleId,
    Long orderId,
    LocalDate startDate,
    int totalOutput,
    int completedOutput,
    int remainingOutput,
    boolean canMeetDeadline,
    List<ScheduleEntry> entries,
    List<ScheduleWarning> warnings
) {}
