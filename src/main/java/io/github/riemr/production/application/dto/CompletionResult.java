package io.github.riemr.production.application.dto;

import io.github.riemr.production.domain.model.ProficiencyHistory;
import io.github.riemr.production.domain.model.ScheduleEntry;

import java.util.List;

public record CompletionResult(
    ScheduleEntry entry,
    List<ProficiencyHistory> proficiencyChanges
) {}
