package io.github.riemr.production.planning.allocation;

import io.github.riemr.production.domain.model.ScheduleEntry;
import io.github.riemr.production.domain.model.ScheduleWarning;
import lombok.Value;

import java.util.List;

@Value
public class GenerationPlan {
    List<ScheduleEntry> entries;
    List<ScheduleWarning> warnings;
}
