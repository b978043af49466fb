package io.github.riemr.production.planning.catalog;

import java.util.Objects;

/**
 * 習熟度の識別子。作業者と工程の組で一意。
 */
public final class ProficiencyKey {
    private final Long workerId;
    private final Long stepId;

    public ProficiencyKey(Long workerId, Long stepId) {
        this.workerId = workerId;
        this.stepId = stepId;
    }

    public Long getWorkerId() { return workerId; }
    public Long getStepId() { return stepId; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProficiencyKey that = (ProficiencyKey) o;
        return Objects.equals(workerId, that.workerId) &&
               Objects.equals(stepId, that.stepId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(workerId, stepId);
    }

    @Override
    public String toString() {
        return workerId + ":" + stepId;
    }
}
