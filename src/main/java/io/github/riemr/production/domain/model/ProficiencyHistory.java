package io.github.riemr.production.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/** 習熟度変更の履歴。追記のみで更新・削除はしない。 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProficiencyHistory {
    private Long id;
    private Long workerId;
    private Long stepId;
    private Integer oldLevel;
    private Integer newLevel;
    private ProficiencyChangeReason reason;
    private Double avgEfficiency;
    private Integer sampleSize;
    private LocalDateTime createdAt;
}
