package io.github.riemr.production.planning.analysis;

import io.github.riemr.production.domain.model.SkillCategory;
import lombok.Value;

@Value
public class SkillGroupRisk {
    SkillCategory group;
    double requiredHours;
    double availableHours;
    int eligibleWorkers;
}
