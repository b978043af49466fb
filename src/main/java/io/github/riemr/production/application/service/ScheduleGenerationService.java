package io.github.riemr.production.application.service;

import io.github.riemr.production.application.dto.ReplanConstraints;
import io.github.riemr.production.application.dto.ReplanDraft;
import io.github.riemr.production.application.dto.ScheduleResult;
import io.github.riemr.production.application.repository.OrderRepository;
import io.github.riemr.production.application.repository.ProductRepository;
import io.github.riemr.production.application.repository.ScheduleRepository;
import io.github.riemr.production.config.SchedulingProperties;
import io.github.riemr.production.domain.exception.ErrorCode;
import io.github.riemr.production.domain.exception.NotFoundException;
import io.github.riemr.production.domain.exception.PersistenceFailureException;
import io.github.riemr.production.domain.exception.ValidationException;
import io.github.riemr.production.domain.model.Assignment;
import io.github.riemr.production.domain.model.EntryStatus;
import io.github.riemr.production.domain.model.Order;
import io.github.riemr.production.domain.model.OrderStatus;
import io.github.riemr.production.domain.model.Schedule;
import io.github.riemr.production.domain.model.ScheduleEntry;
import io.github.riemr.production.domain.model.ScheduleWarning;
import io.github.riemr.production.domain.model.WarningCode;
import io.github.riemr.production.planning.allocation.GenerationDeadline;
import io.github.riemr.production.planning.allocation.GenerationPlan;
import io.github.riemr.production.planning.allocation.GenerationRequest;
import io.github.riemr.production.planning.allocation.ScheduleGenerator;
import io.github.riemr.production.planning.catalog.ResourceSnapshot;
import io.github.riemr.production.planning.graph.StepGraph;
import io.github.riemr.production.planning.graph.StepGraphBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 受注からスケジュールを生成・再計画し、丸ごと置き換えで保存する。
 * <ul>
 *   <li>同一受注の生成/再計画は排他（実行中なら即座に競合エラー）</li>
 *   <li>作業者情報は呼び出しごとのスナップショットを使う</li>
 *   <li>構造エラー・タイムアウト時は何も保存しない</li>
 * </ul>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScheduleGenerationService {

    private final OrderRepository orderRepository;
    private final ProductRepository productRepository;
    private final ScheduleRepository scheduleRepository;
    private final ResourceCatalogService catalogService;
    private final StepGraphBuilder graphBuilder;
    private final ScheduleGenerator generator;
    private final SchedulingLocks locks;
    private final SchedulingProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    /**
     * @param startDate null なら現在時刻を枠単位に切り上げて開始
     * @param timeout   null なら production.scheduling.generation-timeout
     */
    public ScheduleResult generateSchedule(Long orderId, LocalDate startDate, Duration timeout) {
        return locks.orders().tryWithLock(orderId, () -> doGenerate(orderId, startDate, timeout));
    }

    /**
     * 完了済みエントリを残し、それ以外を作り直す。
     */
    public ScheduleResult replan(Long scheduleId, LocalDate newStartDate, ReplanConstraints constraints) {
        Schedule current = scheduleRepository.findById(scheduleId)
                .orElseThrow(() -> new NotFoundException("Schedule", scheduleId));
        ReplanConstraints c = constraints != null ? constraints : ReplanConstraints.none();
        return locks.orders().tryWithLock(current.getOrderId(),
                () -> doReplan(current.getOrderId(), scheduleId, newStartDate, c));
    }

    /**
     * {@link #replan} と同じ計算を行い、保存せずに案として返す。確定は {@link #replan} で行う。
     */
    public ReplanDraft previewReplan(Long scheduleId, LocalDate newStartDate, ReplanConstraints constraints) {
        Schedule current = scheduleRepository.findById(scheduleId)
                .orElseThrow(() -> new NotFoundException("Schedule", scheduleId));
        ReplanConstraints c = constraints != null ? constraints : ReplanConstraints.none();
        ReplanDraft draft = buildReplan(current.getOrderId(), scheduleId, newStartDate, c).draft();
        log.info("Replan draft for schedule {}: {} entries, completed={}/{}",
                scheduleId, draft.entries().size(), draft.completedOutput(), draft.totalOutput());
        return draft;
    }

    private ScheduleResult doGenerate(Long orderId, LocalDate startDate, Duration timeout) {
        Order order = loadSchedulableOrder(orderId);
        StepGraph graph = buildGraph(order);
        ResourceSnapshot snapshot = catalogService.snapshot();
        LocalDateTime startAt = startOf(startDate);

        log.info("Generating schedule: order={}, quantity={}, start={}", orderId, order.getQuantity(), startAt);
        GenerationPlan plan = generator.generate(GenerationRequest.builder()
                .graph(graph)
                .quantity(order.getQuantity())
                .startAt(startAt)
                .snapshot(snapshot)
                .deadline(deadlineOf(timeout))
                .dueDate(order.getDueDate())
                .build());

        Schedule schedule = Schedule.builder()
                .orderId(orderId)
                .startDate(startAt.toLocalDate())
                .createdAt(LocalDateTime.now(clock))
                .entries(plan.getEntries())
                .build();
        Schedule saved = persist(order, schedule);
        log.info("Schedule {} saved for order {}: {} entries, {} warnings",
                saved.getId(), orderId, saved.getEntries().size(), plan.getWarnings().size());
        return new ScheduleResult(saved, plan.getWarnings());
    }

    private ScheduleResult doReplan(Long orderId, Long scheduleId, LocalDate newStartDate, ReplanConstraints constraints) {
        Replanned replanned = buildReplan(orderId, scheduleId, newStartDate, constraints);
        ReplanDraft draft = replanned.draft();
        Schedule schedule = Schedule.builder()
                .orderId(orderId)
                .startDate(draft.startDate())
                .createdAt(LocalDateTime.now(clock))
                .entries(draft.entries())
                .build();
        Schedule saved = persist(replanned.order(), schedule);
        log.info("Schedule {} replaced by {}: {} entries, {} warnings",
                scheduleId, saved.getId(), saved.getEntries().size(), draft.warnings().size());
        return new ScheduleResult(saved, draft.warnings());
    }

    private Replanned buildReplan(Long orderId, Long scheduleId, LocalDate newStartDate, ReplanConstraints constraints) {
        // ロック取得前に置き換えられていないか再確認
        Schedule current = scheduleRepository.findById(scheduleId)
                .orElseThrow(() -> new NotFoundException("Schedule", scheduleId));
        Order order = loadSchedulableOrder(orderId);
        StepGraph graph = buildGraph(order);
        int quantity = order.getQuantity();

        List<ScheduleEntry> kept = new ArrayList<>();
        List<ScheduleWarning> warnings = new ArrayList<>();
        Map<Long, Integer> produced = new HashMap<>();
        Map<Long, Integer> keptPlanned = new HashMap<>();
        Map<Long, LocalDateTime> anchors = new HashMap<>();
        for (ScheduleEntry e : current.getEntries()) {
            if (e.isCompleted()) {
                int output = e.getActualOutput() == null ? 0 : e.getActualOutput();
                // 作りすぎた分は計画に数えない。実績はそのまま残す
                int planned = Math.min(output, Math.max(0, quantity - keptPlanned.getOrDefault(e.getStepId(), 0)));
                kept.add(rekey(e, planned));
                keptPlanned.merge(e.getStepId(), planned, Integer::sum);
                produced.merge(e.getStepId(), output, Integer::sum);
                LocalDateTime done = e.completedAt() != null ? e.completedAt() : e.plannedEnd();
                anchors.merge(e.getStepId(), done, (a, b) -> a.isAfter(b) ? a : b);
            } else if (e.getStatus() == EntryStatus.IN_PROGRESS) {
                warnings.add(new ScheduleWarning(WarningCode.IN_PROGRESS_ENTRY_REPLANNED, e.getStepId(), e.getWorkDate(),
                        "In-progress entry " + e.getId() + " was discarded and rescheduled"));
            }
        }
        Map<Long, Integer> remaining = new HashMap<>();
        produced.forEach((stepId, done) -> remaining.put(stepId, Math.max(0, quantity - done)));

        ResourceSnapshot snapshot = catalogService.snapshot().withoutWorkers(constraints.excludedWorkerIds());
        LocalDateTime startAt = startOf(newStartDate);
        log.info("Replanning schedule {} (order {}): keeping {} completed entries, start={}",
                scheduleId, orderId, kept.size(), startAt);

        GenerationPlan plan = generator.generate(GenerationRequest.builder()
                .graph(graph)
                .quantity(quantity)
                .remainingByStep(remaining)
                .completionAnchors(anchors)
                .startAt(startAt)
                .snapshot(snapshot)
                .deadline(deadlineOf(constraints.timeout()))
                .dueDate(order.getDueDate())
                .build());
        warnings.addAll(plan.getWarnings());

        List<ScheduleEntry> entries = new ArrayList<>(kept);
        entries.addAll(plan.getEntries());
        entries.sort(Comparator.comparing(ScheduleEntry::getWorkDate)
                .thenComparing(ScheduleEntry::getStartTime)
                .thenComparingInt(e -> graph.indexOf(e.getStepId())));

        int finished = graph.topologicalOrder().stream()
                .mapToInt(step -> keptPlanned.getOrDefault(step.getId(), 0))
                .min()
                .orElse(0);
        boolean canMeet = warnings.stream().noneMatch(w -> w.getCode() == WarningCode.DEADLINE_EXCEEDED);
        return new Replanned(order, new ReplanDraft(scheduleId, orderId, startAt.toLocalDate(),
                quantity, finished, quantity - finished, canMeet, entries, warnings));
    }

    private record Replanned(Order order, ReplanDraft draft) {}

    private Order loadSchedulableOrder(Long orderId) {
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new NotFoundException("Order", orderId));
        if (order.getStatus() == OrderStatus.COMPLETED) {
            throw new ValidationException(ErrorCode.ORDER_COMPLETED, "Order " + orderId + " is already completed");
        }
        if (order.getQuantity() == null || order.getQuantity() <= 0) {
            throw new ValidationException(ErrorCode.INVALID_QUANTITY,
                    "Order " + orderId + " has invalid quantity: " + order.getQuantity());
        }
        return order;
    }

    private StepGraph buildGraph(Order order) {
        StepGraph graph = graphBuilder.build(productRepository.findSteps(order.getProductId()));
        if (graph.isEmpty()) {
            throw new ValidationException(ErrorCode.MALFORMED_STEP,
                    "Product " + order.getProductId() + " has no production steps");
        }
        return graph;
    }

    private Schedule persist(Order order, Schedule schedule) {
        try {
            return transactionTemplate.execute(status -> {
                Schedule saved = scheduleRepository.replaceSchedule(order.getId(), schedule);
                if (order.getStatus() == OrderStatus.PENDING) {
                    orderRepository.updateStatus(order.getId(), OrderStatus.SCHEDULED);
                }
                return saved;
            });
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to save schedule for order " + order.getId(), e);
        }
    }

    private GenerationDeadline deadlineOf(Duration timeout) {
        return GenerationDeadline.after(timeout != null ? timeout : properties.getGenerationTimeout(), clock);
    }

    LocalDateTime startOf(LocalDate startDate) {
        if (startDate != null) {
            return startDate.atStartOfDay();
        }
        return roundUp(LocalDateTime.now(clock), properties.getReplanSlotMinutes());
    }

    static LocalDateTime roundUp(LocalDateTime time, int slotMinutes) {
        LocalDateTime floor = time.truncatedTo(ChronoUnit.HOURS)
                .plusMinutes((long) (time.getMinute() / slotMinutes) * slotMinutes);
        return floor.equals(time) ? time : floor.plusMinutes(slotMinutes);
    }

    /** 完了エントリを新スケジュールへ移す。計画出来高を置き換え、割当もそれに合わせて按分し直す。実績は変えない。 */
    static ScheduleEntry rekey(ScheduleEntry e, int plannedOutput) {
        List<Assignment> assignments = new ArrayList<>();
        int planned = e.getAssignments().stream()
                .mapToInt(a -> a.getPlannedOutput() == null ? 0 : a.getPlannedOutput()).sum();
        int distributed = 0;
        for (Assignment a : e.getAssignments()) {
            int share = planned > 0 && a.getPlannedOutput() != null
                    ? (int) ((long) plannedOutput * a.getPlannedOutput() / planned) : 0;
            distributed += share;
            assignments.add(Assignment.builder().workerId(a.getWorkerId()).plannedOutput(share).build());
        }
        if (!assignments.isEmpty()) {
            Assignment first = assignments.get(0);
            first.setPlannedOutput(first.getPlannedOutput() + plannedOutput - distributed);
        }
        return e.toBuilder()
                .id(null)
                .scheduleId(null)
                .plannedOutput(plannedOutput)
                .assignments(assignments)
                .build();
    }
}
