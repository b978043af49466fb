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
import io.github.riemr.production.domain.model.OrderStatus;
import io.github.riemr.production.domain.model.SkillCategory;
import io.github.riemr.production.domain.model.StepCategory;
import io.github.riemr.production.planning.analysis.CapacityRiskAnalyzer;
import io.github.riemr.production.planning.analysis.DeadlineRisk;
import io.github.riemr.production.planning.analysis.SkillGroupRisk;
import io.github.riemr.production.planning.assignment.WorkerAssignmentResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;

import static io.github.riemr.production.Fixtures.MONDAY;
import static io.github.riemr.production.Fixtures.calendar;
import static io.github.riemr.production.Fixtures.snapshot;
import static io.github.riemr.production.Fixtures.step;
import static io.github.riemr.production.Fixtures.worker;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class CapacityAnalysisServiceTest {

    private ScheduleRepository scheduleRepository;
    private CapacityAnalysisService service;

    @BeforeEach
    void setup() {
        OrderRepository orderRepository = mock(OrderRepository.class);
        ProductRepository productRepository = mock(ProductRepository.class);
        scheduleRepository = mock(ScheduleRepository.class);
        ResourceCatalogService catalogService = mock(ResourceCatalogService.class);
        Clock clock = Clock.fixed(MONDAY.atTime(7, 0).toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        service = new CapacityAnalysisService(orderRepository, productRepository, scheduleRepository, catalogService,
                new CapacityRiskAnalyzer(calendar(), new WorkerAssignmentResolver(3, false)),
                new SchedulingProperties(), clock);

        when(orderRepository.findOpen()).thenReturn(List.of(Order.builder().id(1L).productId(1L)
                .productName("T-shirt").quantity(5000).dueDate(MONDAY.plusDays(5))
                .status(OrderStatus.PENDING).build()));
        when(productRepository.findSteps(1L)).thenReturn(List.of(
                step(1, 1, StepCategory.CUTTING, 10),
                step(2, 2, StepCategory.SEWING, 20, 1L)));
        when(catalogService.snapshot()).thenReturn(snapshot(List.of(
                worker(1, SkillCategory.OTHER), worker(2, SkillCategory.SEWING))));
    }

    private static ScenarioRequest scenario(WorkerPoolOverride... overrides) {
        ScenarioRequest request = new ScenarioRequest();
        request.setName("what-if");
        request.setWeeks(1);
        request.setWorkerPool(List.of(overrides));
        return request;
    }

    private static SkillGroupRisk sewing(DeadlineRisk risk) {
        return risk.getGroups().stream().filter(g -> g.getGroup() == SkillCategory.SEWING).findFirst().orElseThrow();
    }

    @Test
    void analyzeScenario_withoutOverridesMatchesCurrentRisks() {
        ScenarioAnalysis analysis = service.analyzeScenario(scenario());

        assertThat(analysis.availableWorkers()).isEqualTo(2);
        assertThat(analysis.deadlineRisks()).isEqualTo(service.getDeadlineRisks());
        assertThat(analysis.deadlineRisks().get(0).isCanMeet()).isTrue();
        assertThat(analysis.capacity().getTotalAvailableHours()).isEqualTo(80.0);
    }

    @Test
    void analyzeScenario_unavailableSewerMakesOrderLate() {
        ScenarioAnalysis analysis = service.analyzeScenario(scenario(new WorkerPoolOverride(2L, false, null)));

        DeadlineRisk risk = analysis.deadlineRisks().get(0);
        assertThat(analysis.name()).isEqualTo("what-if");
        assertThat(analysis.availableWorkers()).isEqualTo(1);
        assertThat(risk.isCanMeet()).isFalse();
        assertThat(sewing(risk).getEligibleWorkers()).isZero();
        assertThat(analysis.capacity().getTotalAvailableHours()).isEqualTo(40.0);
    }

    @Test
    void analyzeScenario_reducedHoursScaleAvailableCapacity() {
        ScenarioAnalysis analysis = service.analyzeScenario(scenario(new WorkerPoolOverride(2L, true, 4.0)));

        DeadlineRisk risk = analysis.deadlineRisks().get(0);
        assertThat(sewing(risk).getAvailableHours()).isEqualTo(20.0);
        assertThat(sewing(risk).getEligibleWorkers()).isEqualTo(1);
        assertThat(risk.isCanMeet()).isFalse();
        assertThat(risk.getShortfallHours()).isEqualTo(7.8);
        assertThat(analysis.capacity().getTotalAvailableHours()).isEqualTo(60.0);
    }

    @Test
    void analyzeScenario_ignoresUnknownWorkers() {
        ScenarioAnalysis analysis = service.analyzeScenario(scenario(new WorkerPoolOverride(99L, false, null)));

        assertThat(analysis.availableWorkers()).isEqualTo(2);
        assertThat(analysis.deadlineRisks().get(0).isCanMeet()).isTrue();
    }

    @Test
    void analyzeScenario_rejectsHoursOutsideOfDay() {
        assertThatThrownBy(() -> service.analyzeScenario(scenario(new WorkerPoolOverride(2L, true, 25.0))))
                .isInstanceOfSatisfying(ValidationException.class,
                        e -> assertThat(e.getCode()).isEqualTo(ErrorCode.INVALID_TIME_WINDOW));
    }

    @Test
    void analyzeScenario_savesNothing() {
        service.analyzeScenario(scenario(new WorkerPoolOverride(1L, false, null)));

        verify(scheduleRepository, never()).replaceSchedule(any(), any());
        verify(scheduleRepository, never()).updateEntryActuals(any());
    }
}
