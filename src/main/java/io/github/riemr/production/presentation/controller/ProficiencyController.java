package io.github.riemr.production.presentation.controller;

import io.github.riemr.production.application.dto.ProficiencyUpdateRequest;
import io.github.riemr.production.application.dto.WorkerProductivity;
import io.github.riemr.production.application.service.EfficiencyFeedbackService;
import io.github.riemr.production.application.service.ProductivityAnalyticsService;
import io.github.riemr.production.application.service.ProficiencyService;
import io.github.riemr.production.domain.model.Proficiency;
import io.github.riemr.production.domain.model.ProficiencyHistory;
import io.github.riemr.production.planning.feedback.ProficiencyAdjustment;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ProficiencyController {

    private final ProficiencyService proficiencyService;
    private final EfficiencyFeedbackService feedbackService;
    private final ProductivityAnalyticsService analyticsService;

    @PutMapping("/workers/{workerId}/proficiencies/{stepId}")
    public Proficiency update(@PathVariable Long workerId, @PathVariable Long stepId,
                              @Valid @RequestBody ProficiencyUpdateRequest req) {
        return proficiencyService.setProficiency(workerId, stepId, req.getLevel());
    }

    @GetMapping("/workers/{workerId}/proficiency-history")
    public List<ProficiencyHistory> history(@PathVariable Long workerId) {
        return proficiencyService.getHistory(workerId);
    }

    @GetMapping("/workers/{workerId}/productivity")
    public WorkerProductivity productivity(@PathVariable Long workerId) {
        return analyticsService.getWorkerProductivity(workerId);
    }

    @GetMapping("/proficiencies/adjustments")
    public List<ProficiencyAdjustment> previewAdjustments() {
        return feedbackService.previewAdjustments();
    }

    @PostMapping("/proficiencies/recalculate")
    public List<ProficiencyHistory> recalculate() {
        return feedbackService.recalculateAll();
    }
}
