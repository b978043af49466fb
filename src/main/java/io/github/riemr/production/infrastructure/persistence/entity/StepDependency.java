package io.github.riemr.production.infrastructure.persistence.entity;

import lombok.Data;

/** step_dependency の 1 行。 */
@Data
public class StepDependency {
    private Long stepId;
    private Long dependsOnStepId;
}
