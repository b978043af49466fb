package io.github.riemr.production.application.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.time.LocalTime;

@Data
public class RecordCompletionRequest {
    @NotNull
    @PositiveOrZero
    private Integer actualOutput;

    @NotNull
    private LocalTime actualEndTime;

    // 開始未記録の場合のみ使う
    private LocalTime actualStartTime;

    private String notes;
}
