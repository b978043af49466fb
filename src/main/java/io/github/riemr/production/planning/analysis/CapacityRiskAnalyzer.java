package io.github.riemr.production.planning.analysis;

import io.github.riemr.production.domain.exception.ErrorCode;
import io.github.riemr.production.domain.exception.ValidationException;
import io.github.riemr.production.domain.model.Order;
import io.github.riemr.production.domain.model.ProductStep;
import io.github.riemr.production.domain.model.ScheduleEntry;
import io.github.riemr.production.domain.model.SkillCategory;
import io.github.riemr.production.domain.model.Worker;
import io.github.riemr.production.planning.assignment.WorkerAssignmentResolver;
import io.github.riemr.production.planning.calendar.ShiftCalendar;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 納期リスク・残業見込み・週次稼働率の計算。副作用なし。
 */
public class CapacityRiskAnalyzer {

    private static final double EPS = 1e-9;

    private final ShiftCalendar calendar;
    private final WorkerAssignmentResolver resolver;

    public CapacityRiskAnalyzer(ShiftCalendar calendar, WorkerAssignmentResolver resolver) {
        this.calendar = calendar;
        this.resolver = resolver;
    }

    public List<DeadlineRisk> deadlineRisks(CapacityInput input) {
        double efficiency = efficiencyOf(input);
        Map<Long, Double> factors = capacityFactors(input);
        Map<SkillCategory, Integer> headcount = new EnumMap<>(SkillCategory.class);
        Map<SkillCategory, Double> crew = new EnumMap<>(SkillCategory.class);
        for (SkillCategory group : SkillCategory.values()) {
            int count = 0;
            double factor = 0;
            for (Worker w : input.getSnapshot().getActiveWorkers()) {
                if (!resolver.canWorkGroup(w, group)) continue;
                count++;
                factor += factors.get(w.getId());
            }
            headcount.put(group, count);
            crew.put(group, factor);
        }

        List<DeadlineRisk> risks = new ArrayList<>();
        for (Order order : input.getOpenOrders()) {
            if (order.getStatus() == null || !order.getStatus().isOpen()) continue;
            List<ProductStep> steps = input.getStepsByProduct().getOrDefault(order.getProductId(), List.of());
            List<ScheduleEntry> entries = input.getEntriesByOrder().getOrDefault(order.getId(), List.of());
            Map<SkillCategory, Double> requiredSeconds = requiredSecondsByGroup(order, steps, entries);

            double workHours = calendar.workSecondsBetween(input.getNow(),
                    order.getDueDate().plusDays(1).atStartOfDay()) / 3600.0;

            List<SkillGroupRisk> groups = new ArrayList<>();
            double required = 0;
            double available = 0;
            double shortfall = 0;
            boolean canMeet = true;
            for (SkillCategory group : SkillCategory.values()) {
                double req = requiredSeconds.getOrDefault(group, 0.0) / 3600.0 / efficiency;
                double avail = workHours * crew.get(group);
                if (req > avail + EPS) {
                    canMeet = false;
                    shortfall += req - avail;
                }
                required += req;
                available += avail;
                groups.add(new SkillGroupRisk(group, round1(req), round1(avail), headcount.get(group)));
            }

            risks.add(DeadlineRisk.builder()
                    .orderId(order.getId())
                    .productName(order.getProductName())
                    .quantity(order.getQuantity())
                    .dueDate(order.getDueDate())
                    .status(order.getStatus())
                    .daysToDue(ChronoUnit.DAYS.between(input.getNow().toLocalDate(), order.getDueDate()))
                    .requiredHours(round1(required))
                    .availableHours(round1(available))
                    .shortfallHours(round1(shortfall))
                    .canMeet(canMeet)
                    .groups(groups)
                    .build());
        }
        risks.sort(Comparator.comparingLong(DeadlineRisk::getDaysToDue).thenComparing(DeadlineRisk::getOrderId));
        return risks;
    }

    public List<OvertimeProjection> overtimeProjections(CapacityInput input) {
        double efficiency = efficiencyOf(input);
        Map<Long, ProductStep> stepById = stepIndex(input);
        LocalDate today = input.getNow().toLocalDate();

        TreeMap<LocalDate, List<ScheduleEntry>> byDate = new TreeMap<>();
        for (ScheduleEntry e : allEntries(input)) {
            byDate.computeIfAbsent(e.getWorkDate(), d -> new ArrayList<>()).add(e);
        }
        if (byDate.isEmpty() || byDate.lastKey().isBefore(today)) {
            return List.of();
        }

        double active = crewSize(input);
        List<OvertimeProjection> result = new ArrayList<>();
        for (LocalDate d = today; !d.isAfter(byDate.lastKey()); d = d.plusDays(1)) {
            List<ScheduleEntry> day = byDate.getOrDefault(d, List.of());
            if (!calendar.isWorkingDay(d) && day.isEmpty()) continue;
            double required = pendingSeconds(day, stepById) / 3600.0 / efficiency;
            double standard = calendar.shiftHours(d) * active;
            result.add(new OvertimeProjection(d, round1(required), round1(standard),
                    round1(Math.max(0, required - standard)), day.size()));
        }
        return result;
    }

    public CapacityAnalysis capacityAnalysis(CapacityInput input, int weeks) {
        if (weeks < 1) {
            throw new ValidationException(ErrorCode.INVALID_HORIZON, "weeks must be >= 1: " + weeks);
        }
        double efficiency = efficiencyOf(input);
        Map<Long, ProductStep> stepById = stepIndex(input);
        double active = crewSize(input);
        LocalDate firstMonday = input.getNow().toLocalDate().with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        List<ScheduleEntry> entries = allEntries(input);

        List<WeeklyCapacity> result = new ArrayList<>();
        double totalRequired = 0;
        double totalAvailable = 0;
        for (int i = 0; i < weeks; i++) {
            LocalDate start = firstMonday.plusWeeks(i);
            LocalDate end = start.plusDays(6);
            List<ScheduleEntry> inWeek = entries.stream()
                    .filter(e -> !e.getWorkDate().isBefore(start) && !e.getWorkDate().isAfter(end))
                    .toList();
            double required = pendingSeconds(inWeek, stepById) / 3600.0 / efficiency;
            double available = 0;
            for (LocalDate d = start; !d.isAfter(end); d = d.plusDays(1)) {
                available += calendar.shiftHours(d) * active;
            }
            totalRequired += required;
            totalAvailable += available;
            result.add(new WeeklyCapacity(start, end, round1(required), round1(available),
                    round1(utilization(required, available))));
        }

        double unscheduled = 0;
        for (Order order : input.getOpenOrders()) {
            if (!input.getEntriesByOrder().getOrDefault(order.getId(), List.of()).isEmpty()) continue;
            unscheduled += order.getQuantity() * totalTime(input.getStepsByProduct()
                    .getOrDefault(order.getProductId(), List.of())) / 3600.0 / efficiency;
        }
        totalRequired += unscheduled;

        return CapacityAnalysis.builder()
                .weeks(result)
                .unscheduledHours(round1(unscheduled))
                .totalRequiredHours(round1(totalRequired))
                .totalAvailableHours(round1(totalAvailable))
                .utilization(round1(utilization(totalRequired, totalAvailable)))
                .build();
    }

    /**
     * 作業者ごとの稼働係数（定時 = 1.0）。1 日の稼働時間が指定されていれば、
     * 直近の稼働日の実働時間に対する比率にする。
     */
    private Map<Long, Double> capacityFactors(CapacityInput input) {
        Map<Long, Double> hours = input.getHoursPerDayByWorker();
        double standard = hours.isEmpty() ? 0
                : calendar.shiftHours(calendar.nextOpenSlot(input.getNow()).toLocalDate());
        Map<Long, Double> factors = new HashMap<>();
        for (Worker w : input.getSnapshot().getActiveWorkers()) {
            Double h = hours.get(w.getId());
            factors.put(w.getId(), h == null || standard <= 0 ? 1.0 : h / standard);
        }
        return factors;
    }

    private double crewSize(CapacityInput input) {
        return capacityFactors(input).values().stream().mapToDouble(Double::doubleValue).sum();
    }

    private Map<SkillCategory, Double> requiredSecondsByGroup(Order order, List<ProductStep> steps,
                                                              List<ScheduleEntry> entries) {
        Map<SkillCategory, Double> seconds = new EnumMap<>(SkillCategory.class);
        if (entries.isEmpty()) {
            for (ProductStep step : steps) {
                seconds.merge(WorkerAssignmentResolver.skillGroupOf(step),
                        (double) order.getQuantity() * step.timePerPiece(), Double::sum);
            }
            return seconds;
        }
        Map<Long, ProductStep> byId = new HashMap<>();
        steps.forEach(s -> byId.put(s.getId(), s));
        for (ScheduleEntry e : entries) {
            if (e.isCompleted()) continue;
            ProductStep step = byId.get(e.getStepId());
            if (step == null) continue;
            seconds.merge(WorkerAssignmentResolver.skillGroupOf(step),
                    (double) e.getPlannedOutput() * step.timePerPiece(), Double::sum);
        }
        return seconds;
    }

    private static double pendingSeconds(Collection<ScheduleEntry> entries, Map<Long, ProductStep> stepById) {
        double total = 0;
        for (ScheduleEntry e : entries) {
            if (e.isCompleted()) continue;
            ProductStep step = stepById.get(e.getStepId());
            if (step == null) continue;
            total += (double) e.getPlannedOutput() * step.timePerPiece();
        }
        return total;
    }

    private static double totalTime(List<ProductStep> steps) {
        return steps.stream().mapToInt(ProductStep::timePerPiece).sum();
    }

    private static Map<Long, ProductStep> stepIndex(CapacityInput input) {
        Map<Long, ProductStep> byId = new HashMap<>();
        input.getStepsByProduct().values().forEach(list -> list.forEach(s -> byId.put(s.getId(), s)));
        return byId;
    }

    private static List<ScheduleEntry> allEntries(CapacityInput input) {
        List<ScheduleEntry> all = new ArrayList<>();
        input.getEntriesByOrder().values().forEach(all::addAll);
        return all;
    }

    private static double efficiencyOf(CapacityInput input) {
        return input.getEfficiencyFactor() > 0 ? input.getEfficiencyFactor() : 1.0;
    }

    private static double utilization(double required, double available) {
        return available > 0 ? required / available * 100 : 0;
    }

    static double round1(double v) {
        return Math.round(v * 10) / 10.0;
    }
}
