package io.github.riemr.production.application.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * シナリオでの作業者 1 人分の上書き。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class WorkerPoolOverride {
    @NotNull
    private Long workerId;

    /** false なら期間中まったく稼働しない */
    private boolean available = true;

    @DecimalMin("0.0")
    @DecimalMax("24.0")
    private Double hoursPerDay;      // null なら定時
}
