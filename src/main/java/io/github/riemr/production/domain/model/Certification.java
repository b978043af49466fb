package io.github.riemr.production.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Certification {
    private Long workerId;
    private Long equipmentId;
    private LocalDate certifiedAt;
    /** null なら無期限。 */
    private LocalDate expiresAt;

    /** 指定日に有効か。失効日当日は無効。 */
    public boolean isValidOn(LocalDate date) {
        return expiresAt == null || date.isBefore(expiresAt);
    }
}
