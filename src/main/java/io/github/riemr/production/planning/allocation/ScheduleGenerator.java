package io.github.riemr.production.planning.allocation;

import io.github.riemr.production.domain.model.Assignment;
import io.github.riemr.production.domain.model.EntryStatus;
import io.github.riemr.production.domain.model.Equipment;
import io.github.riemr.production.domain.model.ProductStep;
import io.github.riemr.production.domain.model.ScheduleEntry;
import io.github.riemr.production.domain.model.ScheduleWarning;
import io.github.riemr.production.domain.model.WarningCode;
import io.github.riemr.production.planning.assignment.Crew;
import io.github.riemr.production.planning.assignment.WorkerAssignmentResolver;
import io.github.riemr.production.planning.calendar.ShiftCalendar;
import io.github.riemr.production.planning.catalog.ResourceSnapshot;
import io.github.riemr.production.planning.graph.StepGraph;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 単一ラインモデルで工程をトポロジカル順に並べ、枠割りと作業者割当を行う。
 * <p>
 * 所要時間はクルーに依存し、クルーは枠の日付に依存するため工程ごとに最大 2 パスで収束させる。
 * 1 パス目は開始日のクルーで全枠を見積もり、枠の日付ごとにクルーを引き直して
 * 1 つでも異なれば日付別クルーで 2 パス目を行う。
 * </p>
 */
@Slf4j
public class ScheduleGenerator {

    private final ShiftCalendar calendar;
    private final TimeSlotAllocator allocator;
    private final WorkerAssignmentResolver resolver;

    public ScheduleGenerator(ShiftCalendar calendar, TimeSlotAllocator allocator, WorkerAssignmentResolver resolver) {
        this.calendar = calendar;
        this.allocator = allocator;
        this.resolver = resolver;
    }

    public GenerationPlan generate(GenerationRequest request) {
        StepGraph graph = request.getGraph();
        ResourceSnapshot snapshot = request.getSnapshot();
        GenerationDeadline deadline = request.getDeadline();

        LocalDateTime cursor = calendar.nextOpenSlot(request.getStartAt());
        Map<Long, LocalDateTime> completion = new HashMap<>(request.getCompletionAnchors());
        List<ScheduleEntry> entries = new ArrayList<>();
        List<ScheduleWarning> warnings = new ArrayList<>();

        for (ProductStep step : graph.topologicalOrder()) {
            deadline.check();
            int remaining = request.getRemainingByStep().getOrDefault(step.getId(), request.getQuantity());
            if (remaining <= 0) {
                log.debug("Step {} already fulfilled, skipping", step.getId());
                continue;
            }
            checkEquipment(step, snapshot, cursor.toLocalDate(), warnings);

            LocalDateTime earliest = cursor;
            for (Long dep : graph.predecessorsOf(step.getId())) {
                LocalDateTime done = completion.get(dep);
                if (done != null && done.isAfter(earliest)) earliest = done;
            }
            earliest = calendar.nextOpenSlot(earliest);

            List<TimeSlot> slots = allocateStep(step, remaining, earliest, snapshot, deadline);
            Map<LocalDate, Crew> crews = new HashMap<>();
            boolean warnedUnassigned = false;
            for (TimeSlot slot : slots) {
                Crew crew = crews.computeIfAbsent(slot.getDate(), d -> resolver.resolveCrew(step, d, snapshot));
                List<Assignment> assignments = resolver.apportion(slot.getOutput(), step, crew);
                if (crew.isEmpty() && !warnedUnassigned) {
                    warnings.add(new ScheduleWarning(WarningCode.NO_ELIGIBLE_WORKER, step.getId(), slot.getDate(),
                            "No eligible worker for step '" + step.getName() + "'"));
                    warnedUnassigned = true;
                }
                entries.add(ScheduleEntry.builder()
                        .stepId(step.getId())
                        .workDate(slot.getDate())
                        .startTime(slot.getStart())
                        .endTime(slot.getEnd())
                        .plannedOutput(slot.getOutput())
                        .status(EntryStatus.NOT_STARTED)
                        .assignments(new ArrayList<>(assignments))
                        .build());
            }

            TimeSlot last = slots.get(slots.size() - 1);
            LocalDateTime end = last.getDate().atTime(last.getEnd());
            completion.merge(step.getId(), end, (a, b) -> a.isAfter(b) ? a : b);
            cursor = end;
        }

        if (request.getDueDate() != null && !entries.isEmpty()) {
            LocalDate lastDay = entries.stream().map(ScheduleEntry::getWorkDate).max(Comparator.naturalOrder()).get();
            if (lastDay.isAfter(request.getDueDate())) {
                warnings.add(new ScheduleWarning(WarningCode.DEADLINE_EXCEEDED, null, lastDay,
                        "Schedule ends on " + lastDay + " after due date " + request.getDueDate()));
            }
        }

        entries.sort(Comparator.comparing(ScheduleEntry::getWorkDate)
                .thenComparing(ScheduleEntry::getStartTime)
                .thenComparingInt(e -> graph.indexOf(e.getStepId())));
        log.debug("Generated {} entries ({} warnings)", entries.size(), warnings.size());
        return new GenerationPlan(entries, warnings);
    }

    private List<TimeSlot> allocateStep(ProductStep step, int quantity, LocalDateTime earliest,
                                        ResourceSnapshot snapshot, GenerationDeadline deadline) {
        int tpp = step.timePerPiece();
        Crew initial = resolver.resolveCrew(step, earliest.toLocalDate(), snapshot);
        List<TimeSlot> firstPass = allocator.allocate(step, quantity, earliest,
                d -> initial.piecesPerSecond(tpp), deadline);

        Map<LocalDate, Crew> perDate = new HashMap<>();
        boolean differs = false;
        for (TimeSlot slot : firstPass) {
            Crew crew = perDate.computeIfAbsent(slot.getDate(), d -> resolver.resolveCrew(step, d, snapshot));
            if (!crew.equals(initial)) differs = true;
        }
        if (!differs || tpp == 0) {
            return firstPass;
        }
        log.debug("Crew changes across days for step {}, re-sizing", step.getId());
        return allocator.allocate(step, quantity, earliest,
                d -> perDate.computeIfAbsent(d, x -> resolver.resolveCrew(step, x, snapshot)).piecesPerSecond(tpp),
                deadline);
    }

    private void checkEquipment(ProductStep step, ResourceSnapshot snapshot, LocalDate date,
                                List<ScheduleWarning> warnings) {
        if (step.getEquipmentId() == null) return;
        Optional<Equipment> equipment = snapshot.equipment(step.getEquipmentId());
        if (equipment.isEmpty() || !equipment.get().getStatus().isOperational()) {
            String status = equipment.map(e -> e.getStatus().name()).orElse("MISSING");
            warnings.add(new ScheduleWarning(WarningCode.EQUIPMENT_UNAVAILABLE, step.getId(), date,
                    "Equipment " + step.getEquipmentId() + " is " + status));
        }
    }
}
