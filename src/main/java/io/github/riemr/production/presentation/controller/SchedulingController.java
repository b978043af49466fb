package io.github.riemr.production.presentation.controller;

import io.github.riemr.production.application.dto.GenerateScheduleRequest;
import io.github.riemr.production.application.dto.ReplanConstraints;
import io.github.riemr.production.application.dto.ReplanDraft;
import io.github.riemr.production.application.dto.ReplanRequest;
import io.github.riemr.production.application.dto.ScenarioAnalysis;
import io.github.riemr.production.application.dto.ScenarioRequest;
import io.github.riemr.production.application.dto.ScheduleResult;
import io.github.riemr.production.application.dto.ScheduleView;
import io.github.riemr.production.application.service.CapacityAnalysisService;
import io.github.riemr.production.application.service.ScheduleGenerationService;
import io.github.riemr.production.application.service.ScheduleQueryService;
import io.github.riemr.production.planning.analysis.CapacityAnalysis;
import io.github.riemr.production.planning.analysis.DeadlineRisk;
import io.github.riemr.production.planning.analysis.OvertimeProjection;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.List;

@RestController
@RequestMapping("/api/scheduling")
@RequiredArgsConstructor
public class SchedulingController {

    private final ScheduleGenerationService generationService;
    private final ScheduleQueryService queryService;
    private final CapacityAnalysisService capacityService;

    @PostMapping("/orders/{orderId}/schedule")
    public ScheduleResult generate(@PathVariable Long orderId,
                                   @Valid @RequestBody(required = false) GenerateScheduleRequest req) {
        GenerateScheduleRequest r = req != null ? req : new GenerateScheduleRequest();
        return generationService.generateSchedule(orderId, r.getStartDate(), toDuration(r.getTimeoutSeconds()));
    }

    @PostMapping("/schedules/{scheduleId}/replan")
    public ScheduleResult replan(@PathVariable Long scheduleId,
                                 @Valid @RequestBody(required = false) ReplanRequest req) {
        ReplanRequest r = req != null ? req : new ReplanRequest();
        return generationService.replan(scheduleId, r.getNewStartDate(),
                new ReplanConstraints(r.getExcludedWorkerIds(), toDuration(r.getTimeoutSeconds())));
    }

    /** 再計画を保存せずに試算する。確定は /replan。 */
    @PostMapping("/schedules/{scheduleId}/replan/preview")
    public ReplanDraft previewReplan(@PathVariable Long scheduleId,
                                     @Valid @RequestBody(required = false) ReplanRequest req) {
        ReplanRequest r = req != null ? req : new ReplanRequest();
        return generationService.previewReplan(scheduleId, r.getNewStartDate(),
                new ReplanConstraints(r.getExcludedWorkerIds(), toDuration(r.getTimeoutSeconds())));
    }

    @GetMapping("/schedules/{scheduleId}")
    public ScheduleView schedule(@PathVariable Long scheduleId) {
        return queryService.getSchedule(scheduleId);
    }

    @GetMapping("/orders/{orderId}/schedule")
    public ScheduleView scheduleOfOrder(@PathVariable Long orderId) {
        return queryService.getScheduleByOrder(orderId);
    }

    @GetMapping("/deadline-risks")
    public List<DeadlineRisk> deadlineRisks() {
        return capacityService.getDeadlineRisks();
    }

    @GetMapping("/overtime")
    public List<OvertimeProjection> overtime() {
        return capacityService.getOvertimeProjections();
    }

    @GetMapping("/capacity")
    public CapacityAnalysis capacity(@RequestParam(defaultValue = "4") int weeks) {
        return capacityService.getCapacityAnalysis(weeks);
    }

    @PostMapping("/scenarios/analyze")
    public ScenarioAnalysis analyzeScenario(@Valid @RequestBody ScenarioRequest req) {
        return capacityService.analyzeScenario(req);
    }

    private static Duration toDuration(Long seconds) {
        return seconds == null ? null : Duration.ofSeconds(seconds);
    }
}
