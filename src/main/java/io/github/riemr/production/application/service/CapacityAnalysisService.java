package io.github.riemr.production.application.service;

import io.github.riemr.production.application.dto.ScenarioAnalysis;
import io.github.riemr.production.application.dto.ScenarioRequest;
import io.github.riemr.production.application.dto.WorkerPoolOverride;
import io.github.riemr.production.application.repository.OrderRepository;
import io.github.riemr.production.application.repository.ProductRepository;
import io.github.riemr.production.application.repository.ScheduleRepository;
import io.github.riemr.production.config.SchedulingProperties;
import io.github.riemr.production.domain.exception.ErrorCode;
import io.github.riemr.production.domain.exception.ValidationException;
import io.github.riemr.production.domain.model.Order;
import io.github.riemr.production.domain.model.ProductStep;
import io.github.riemr.production.domain.model.ScheduleEntry;
import io.github.riemr.production.planning.analysis.CapacityAnalysis;
import io.github.riemr.production.planning.analysis.CapacityInput;
import io.github.riemr.production.planning.analysis.CapacityRiskAnalyzer;
import io.github.riemr.production.planning.analysis.DeadlineRisk;
import io.github.riemr.production.planning.analysis.OvertimeProjection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 納期リスク・残業見込み・稼働率の照会と、作業者構成を変えた場合の試算。
 * エントリの読み込みは 1 つの REPEATABLE READ トランザクション内で行い、置き換え途中のスケジュールを見せない。
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
public class CapacityAnalysisService {

    private final OrderRepository orderRepository;
    private final ProductRepository productRepository;
    private final ScheduleRepository scheduleRepository;
    private final ResourceCatalogService catalogService;
    private final CapacityRiskAnalyzer analyzer;
    private final SchedulingProperties properties;
    private final Clock clock;

    public List<DeadlineRisk> getDeadlineRisks() {
        return analyzer.deadlineRisks(loadInput());
    }

    public List<OvertimeProjection> getOvertimeProjections() {
        return analyzer.overtimeProjections(loadInput());
    }

    public CapacityAnalysis getCapacityAnalysis(int weeks) {
        if (weeks < 1) {
            throw new ValidationException(ErrorCode.INVALID_HORIZON, "weeks must be >= 1: " + weeks);
        }
        return analyzer.capacityAnalysis(loadInput(), weeks);
    }

    /**
     * 作業者の欠勤・稼働時間の変更を仮定して分析し直す。既存のスケジュールやマスタは変えない。
     * 稼働中でない作業者への上書きは無視する。
     */
    public ScenarioAnalysis analyzeScenario(ScenarioRequest request) {
        if (request.getWeeks() < 1) {
            throw new ValidationException(ErrorCode.INVALID_HORIZON, "weeks must be >= 1: " + request.getWeeks());
        }
        Set<Long> unavailable = new HashSet<>();
        Map<Long, Double> hoursPerDay = new HashMap<>();
        for (WorkerPoolOverride o : request.getWorkerPool()) {
            if (!o.isAvailable()) {
                unavailable.add(o.getWorkerId());
            } else if (o.getHoursPerDay() != null) {
                if (o.getHoursPerDay() < 0 || o.getHoursPerDay() > 24) {
                    throw new ValidationException(ErrorCode.INVALID_TIME_WINDOW,
                            "hoursPerDay must be within 0..24: " + o.getHoursPerDay());
                }
                hoursPerDay.put(o.getWorkerId(), o.getHoursPerDay());
            }
        }

        CapacityInput base = loadInput();
        CapacityInput input = base.toBuilder()
                .snapshot(base.getSnapshot().withoutWorkers(unavailable))
                .hoursPerDayByWorker(hoursPerDay)
                .build();
        int workers = input.getSnapshot().getActiveWorkers().size();
        log.info("Scenario '{}': {} workers unavailable, {} with adjusted hours, {} remain",
                request.getName(), unavailable.size(), hoursPerDay.size(), workers);
        return new ScenarioAnalysis(
                request.getName(),
                request.getDescription(),
                workers,
                analyzer.deadlineRisks(input),
                analyzer.overtimeProjections(input),
                analyzer.capacityAnalysis(input, request.getWeeks()));
    }

    private CapacityInput loadInput() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<Order> orders = orderRepository.findOpen();
        Map<Long, List<ProductStep>> stepsByProduct = new HashMap<>();
        for (Order order : orders) {
            stepsByProduct.computeIfAbsent(order.getProductId(), productRepository::findSteps);
        }
        List<Long> orderIds = orders.stream().map(Order::getId).toList();
        Map<Long, List<ScheduleEntry>> entriesByOrder = orderIds.isEmpty()
                ? Map.of()
                : scheduleRepository.findEntriesByOrderIds(orderIds).stream()
                        .collect(Collectors.groupingBy(ScheduleEntry::getOrderId));

        double efficiency = trailingEfficiency(now, stepsByProduct);
        log.debug("Capacity input: {} open orders, trailing efficiency {}", orders.size(), efficiency);
        return CapacityInput.builder()
                .now(now)
                .openOrders(orders)
                .stepsByProduct(stepsByProduct)
                .entriesByOrder(entriesByOrder)
                .snapshot(catalogService.snapshot())
                .efficiencyFactor(efficiency)
                .build();
    }

    /** 直近の完了実績から求めた全体効率（標準 = 1.0）。実績がなければ 1.0。 */
    double trailingEfficiency(LocalDateTime now, Map<Long, List<ProductStep>> knownSteps) {
        Map<Long, Optional<ProductStep>> steps = new HashMap<>();
        knownSteps.values().forEach(list -> list.forEach(s -> steps.put(s.getId(), Optional.of(s))));

        double expectedMinutes = 0;
        double actualMinutes = 0;
        List<ScheduleEntry> completed = scheduleRepository.findCompletedEntriesSince(
                now.toLocalDate().minusDays(properties.getEfficiency().getLookbackDays()));
        for (ScheduleEntry e : completed) {
            Optional<ProductStep> step = steps.computeIfAbsent(e.getStepId(), productRepository::findStep);
            double minutes = e.actualMinutes() * Math.max(1, e.getAssignments().size());
            if (step.isEmpty() || minutes <= 0) continue;
            expectedMinutes += e.getPlannedOutput() * (double) step.get().timePerPiece() / 60.0;
            actualMinutes += minutes;
        }
        return actualMinutes > 0 && expectedMinutes > 0 ? expectedMinutes / actualMinutes : 1.0;
    }
}
