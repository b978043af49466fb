package io.github.riemr.production.application.service;

import io.github.riemr.production.application.dto.StepProductivity;
import io.github.riemr.production.application.dto.WorkerProductivity;
import io.github.riemr.production.application.repository.ProductRepository;
import io.github.riemr.production.application.repository.ResourceCatalogRepository;
import io.github.riemr.production.application.repository.ScheduleRepository;
import io.github.riemr.production.domain.exception.NotFoundException;
import io.github.riemr.production.domain.model.Assignment;
import io.github.riemr.production.domain.model.ProductStep;
import io.github.riemr.production.domain.model.ScheduleEntry;
import io.github.riemr.production.domain.model.Worker;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 作業者別の生産性サマリ。クルー作業の出来高は計画時の按分比率で各作業者に配分する。
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ProductivityAnalyticsService {

    private final ScheduleRepository scheduleRepository;
    private final ProductRepository productRepository;
    private final ResourceCatalogRepository catalogRepository;

    public WorkerProductivity getWorkerProductivity(Long workerId) {
        Worker worker = catalogRepository.findWorker(workerId)
                .orElseThrow(() -> new NotFoundException("Worker", workerId));

        Map<Long, Optional<ProductStep>> steps = new HashMap<>();
        Map<Long, StepTotals> byStep = new LinkedHashMap<>();
        double totalMinutes = 0;
        double totalExpected = 0;
        int totalUnits = 0;
        for (ScheduleEntry e : scheduleRepository.findCompletedEntriesByWorker(workerId)) {
            Optional<ProductStep> step = steps.computeIfAbsent(e.getStepId(), productRepository::findStep);
            if (step.isEmpty()) continue;
            double minutes = e.actualMinutes();
            int units = unitsOf(e, workerId);
            double expected = units * (double) step.get().timePerPiece() / 60.0;

            StepTotals t = byStep.computeIfAbsent(step.get().getId(), id -> new StepTotals(step.get()));
            t.units += units;
            t.minutes += minutes;
            t.expected += expected;
            t.entries++;
            totalMinutes += minutes;
            totalExpected += expected;
            totalUnits += units;
        }

        List<StepProductivity> breakdown = new ArrayList<>();
        for (StepTotals t : byStep.values()) {
            breakdown.add(new StepProductivity(
                    t.step.getId(),
                    t.step.getName(),
                    t.step.getCategory() == null ? null : t.step.getCategory().name(),
                    t.units,
                    Math.round(t.minutes),
                    Math.round(efficiency(t.expected, t.minutes)),
                    t.entries,
                    catalogRepository.getProficiency(workerId, t.step.getId())));
        }
        return new WorkerProductivity(worker.getId(), worker.getName(),
                Math.round(totalMinutes / 60 * 10) / 10.0,
                totalUnits,
                Math.round(efficiency(totalExpected, totalMinutes)),
                breakdown);
    }

    /** エントリ実績のうちこの作業者に帰属する出来高。 */
    static int unitsOf(ScheduleEntry e, Long workerId) {
        int actual = e.getActualOutput() == null ? 0 : e.getActualOutput();
        List<Assignment> crew = e.getAssignments();
        if (crew.size() <= 1) return actual;
        int planned = e.getPlannedOutput() == null ? 0 : e.getPlannedOutput();
        for (Assignment a : crew) {
            if (!a.getWorkerId().equals(workerId)) continue;
            if (planned <= 0 || a.getPlannedOutput() == null) return actual / crew.size();
            return (int) Math.round((double) actual * a.getPlannedOutput() / planned);
        }
        return 0;
    }

    private static double efficiency(double expectedMinutes, double actualMinutes) {
        return actualMinutes > 0 ? expectedMinutes / actualMinutes * 100 : 0;
    }

    private static final class StepTotals {
        final ProductStep step;
        int units;
        double minutes;
        double expected;
        int entries;

        StepTotals(ProductStep step) {
            this.step = step;
        }
    }
}
