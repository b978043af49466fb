package io.github.riemr.production.presentation.controller;

import io.github.riemr.production.application.dto.CompletionResult;
import io.github.riemr.production.application.dto.RecordCompletionRequest;
import io.github.riemr.production.application.dto.RecordStartRequest;
import io.github.riemr.production.application.service.ProductionLogService;
import io.github.riemr.production.domain.model.ScheduleEntry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/entries")
@RequiredArgsConstructor
public class ProductionLogController {

    private final ProductionLogService logService;

    @PostMapping("/{entryId}/start")
    public ScheduleEntry start(@PathVariable Long entryId, @RequestBody(required = false) RecordStartRequest req) {
        return logService.recordStart(entryId, req == null ? null : req.getActualStartTime());
    }

    @PostMapping("/{entryId}/complete")
    public CompletionResult complete(@PathVariable Long entryId, @Valid @RequestBody RecordCompletionRequest req) {
        return logService.recordCompletion(entryId, req.getActualOutput(), req.getActualEndTime(),
                req.getActualStartTime(), req.getNotes());
    }
}
