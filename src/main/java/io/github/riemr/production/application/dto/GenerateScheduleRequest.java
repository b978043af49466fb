package io.github.riemr.production.application.dto;

import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.time.LocalDate;

@Data
public class GenerateScheduleRequest {
    private LocalDate startDate;      // null なら現在時刻から

    @Positive
    private Long timeoutSeconds;
}
