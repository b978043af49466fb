package io.github.riemr.production.domain.model;

import lombok.Value;

import java.time.LocalDate;

/** スケジュール生成は成功したが注意が必要な事項。 */
@Value
public class ScheduleWarning {
    WarningCode code;
    Long stepId;
    LocalDate date;
    String message;
}
