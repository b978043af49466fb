package io.github.riemr.production.application.dto;

import io.github.riemr.production.domain.model.Schedule;
import io.github.riemr.production.domain.model.ScheduleWarning;

import java.util.List;

public record ScheduleResult(
    Schedule schedule,
    List<ScheduleWarning> warnings
) {}
