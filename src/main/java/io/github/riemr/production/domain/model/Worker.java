package io.github.riemr.production.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Worker {
    private Long id;
    private String name;
    private WorkerStatus status;
    private SkillCategory skillCategory;

    public boolean isActive() {
        return status == WorkerStatus.ACTIVE;
    }
}
