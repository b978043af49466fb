package io.github.riemr.production.application.service;

import io.github.riemr.production.application.dto.ReplanConstraints;
import io.github.riemr.production.application.dto.ReplanDraft;
import io.github.riemr.production.application.dto.ScheduleResult;
import io.github.riemr.production.application.repository.OrderRepository;
import io.github.riemr.production.application.repository.ProductRepository;
import io.github.riemr.production.application.repository.ScheduleRepository;
import io.github.riemr.production.config.SchedulingProperties;
import io.github.riemr.production.domain.exception.ConcurrencyConflictException;
import io.github.riemr.production.domain.exception.ErrorCode;
import io.github.riemr.production.domain.exception.GraphException;
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
import io.github.riemr.production.domain.model.SkillCategory;
import io.github.riemr.production.domain.model.StepCategory;
import io.github.riemr.production.domain.model.WarningCode;
import io.github.riemr.production.planning.allocation.ScheduleGenerator;
import io.github.riemr.production.planning.allocation.TimeSlotAllocator;
import io.github.riemr.production.planning.assignment.WorkerAssignmentResolver;
import io.github.riemr.production.planning.calendar.ShiftCalendar;
import io.github.riemr.production.planning.graph.StepGraphBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;

import static io.github.riemr.production.Fixtures.MONDAY;
import static io.github.riemr.production.Fixtures.calendar;
import static io.github.riemr.production.Fixtures.snapshot;
import static io.github.riemr.production.Fixtures.step;
import static io.github.riemr.production.Fixtures.worker;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ScheduleGenerationServiceTest {

    private OrderRepository orderRepository;
    private ProductRepository productRepository;
    private ScheduleRepository scheduleRepository;
    private ResourceCatalogService catalogService;
    private SchedulingLocks locks;
    private ScheduleGenerationService service;

    private final Order order = Order.builder().id(1L).productId(1L).quantity(100)
            .dueDate(MONDAY.plusDays(5)).status(OrderStatus.PENDING).build();

    @BeforeEach
    void setup() {
        orderRepository = mock(OrderRepository.class);
        productRepository = mock(ProductRepository.class);
        scheduleRepository = mock(ScheduleRepository.class);
        catalogService = mock(ResourceCatalogService.class);
        locks = new SchedulingLocks();
        ShiftCalendar calendar = calendar();
        WorkerAssignmentResolver resolver = new WorkerAssignmentResolver(3, false);
        Clock clock = Clock.fixed(MONDAY.atTime(10, 7, 30).toInstant(ZoneOffset.UTC), ZoneOffset.UTC);

        service = new ScheduleGenerationService(orderRepository, productRepository, scheduleRepository, catalogService,
                new StepGraphBuilder(),
                new ScheduleGenerator(calendar, new TimeSlotAllocator(calendar), resolver),
                locks,
                new SchedulingProperties(),
                new TransactionTemplate(mock(PlatformTransactionManager.class)),
                clock);

        when(orderRepository.findById(1L)).thenReturn(Optional.of(order));
        when(productRepository.findSteps(1L)).thenReturn(List.of(
                step(1, 1, StepCategory.CUTTING, 10),
                step(2, 2, StepCategory.SEWING, 20, 1L)));
        when(catalogService.snapshot()).thenReturn(snapshot(List.of(
                worker(1, SkillCategory.OTHER), worker(2, SkillCategory.SEWING))));
        when(scheduleRepository.replaceSchedule(eq(1L), any(Schedule.class))).thenAnswer(invocation -> {
            Schedule s = invocation.getArgument(1);
            s.setId(55L);
            return s;
        });
    }

    @Test
    void generateSchedule_savesPlanAndMarksOrderScheduled() {
        ScheduleResult result = service.generateSchedule(1L, MONDAY, null);

        assertThat(result.schedule().getId()).isEqualTo(55L);
        assertThat(result.schedule().getEntries()).hasSize(2);
        assertThat(result.warnings()).isEmpty();
        verify(orderRepository).updateStatus(1L, OrderStatus.SCHEDULED);
    }

    @Test
    void generateSchedule_withoutStartDate_startsAtNextQuarterHour() {
        ScheduleResult result = service.generateSchedule(1L, null, null);

        assertThat(result.schedule().getEntries().get(0).getStartTime()).isEqualTo(LocalTime.of(10, 15));
    }

    @Test
    void generateSchedule_rejectsCompletedOrder() {
        order.setStatus(OrderStatus.COMPLETED);

        assertThatThrownBy(() -> service.generateSchedule(1L, MONDAY, null))
                .isInstanceOfSatisfying(ValidationException.class,
                        e -> assertThat(e.getCode()).isEqualTo(ErrorCode.ORDER_COMPLETED));
        verify(scheduleRepository, never()).replaceSchedule(any(), any());
    }

    @Test
    void generateSchedule_unknownOrder_isNotFound() {
        assertThatThrownBy(() -> service.generateSchedule(99L, MONDAY, null)).isInstanceOf(NotFoundException.class);
    }

    @Test
    void generateSchedule_cyclicProduct_persistsNothing() {
        when(productRepository.findSteps(1L)).thenReturn(List.of(
                step(1, 1, StepCategory.CUTTING, 10, 2L),
                step(2, 2, StepCategory.SEWING, 20, 1L)));

        assertThatThrownBy(() -> service.generateSchedule(1L, MONDAY, null))
                .isInstanceOfSatisfying(GraphException.class, e -> assertThat(e.getCode()).isEqualTo(ErrorCode.CYCLE));
        verify(scheduleRepository, never()).replaceSchedule(any(), any());
        verify(orderRepository, never()).updateStatus(any(), any());
    }

    @Test
    void generateSchedule_translatesStorageFailure() {
        when(scheduleRepository.replaceSchedule(eq(1L), any(Schedule.class)))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> service.generateSchedule(1L, MONDAY, null))
                .isInstanceOfSatisfying(PersistenceFailureException.class,
                        e -> assertThat(e.getCode()).isEqualTo(ErrorCode.PERSISTENCE_FAILURE));
    }

    @Test
    void generateSchedule_failsFastWhileSameOrderIsBeingProcessed() throws Exception {
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Thread other = new Thread(() -> locks.orders().withLock(1L, () -> {
            held.countDown();
            awaitQuietly(release);
            return null;
        }));
        other.start();
        held.await();
        try {
            assertThatThrownBy(() -> service.generateSchedule(1L, MONDAY, null))
                    .isInstanceOf(ConcurrencyConflictException.class);
        } finally {
            release.countDown();
            other.join();
        }
        verify(scheduleRepository, never()).replaceSchedule(any(), any());
    }

    @Test
    void replan_keepsCompletedEntriesAndReschedulesTheRest() {
        ScheduleEntry cutDone = ScheduleEntry.builder().id(10L).scheduleId(7L).stepId(1L).workDate(MONDAY)
                .startTime(LocalTime.of(7, 0)).endTime(LocalTime.of(7, 16, 40)).plannedOutput(100)
                .actualStartTime(LocalTime.of(7, 0)).actualEndTime(LocalTime.of(7, 20)).actualOutput(100)
                .status(EntryStatus.COMPLETED)
                .assignments(new ArrayList<>(List.of(Assignment.builder().entryId(10L).workerId(1L).plannedOutput(100).build())))
                .build();
        ScheduleEntry sewing = ScheduleEntry.builder().id(11L).scheduleId(7L).stepId(2L).workDate(MONDAY)
                .startTime(LocalTime.of(7, 16, 40)).endTime(LocalTime.of(7, 50)).plannedOutput(100)
                .actualStartTime(LocalTime.of(7, 30)).status(EntryStatus.IN_PROGRESS).build();
        Schedule current = Schedule.builder().id(7L).orderId(1L).startDate(MONDAY)
                .entries(new ArrayList<>(List.of(cutDone, sewing))).build();
        when(scheduleRepository.findById(7L)).thenReturn(Optional.of(current));
        order.setStatus(OrderStatus.IN_PROGRESS);

        ScheduleResult result = service.replan(7L, MONDAY.plusDays(1), ReplanConstraints.none());

        List<ScheduleEntry> entries = result.schedule().getEntries();
        assertThat(entries).hasSize(2);
        assertThat(entries.get(0).getId()).isNull();
        assertThat(entries.get(0).getStatus()).isEqualTo(EntryStatus.COMPLETED);
        assertThat(entries.get(0).getPlannedOutput()).isEqualTo(100);
        assertThat(entries.get(1).getStepId()).isEqualTo(2L);
        assertThat(entries.get(1).getWorkDate()).isEqualTo(MONDAY.plusDays(1));
        assertThat(entries.get(1).getStatus()).isEqualTo(EntryStatus.NOT_STARTED);
        assertThat(result.warnings()).extracting(ScheduleWarning::getCode)
                .containsExactly(WarningCode.IN_PROGRESS_ENTRY_REPLANNED);
        verify(orderRepository, never()).updateStatus(any(), any());
    }

    @Test
    void replan_overproducedStepKeepsActualButPlansOnlyOrderQuantity() {
        ScheduleEntry first = completedCut(10L, LocalTime.of(7, 0), LocalTime.of(7, 20), 100, 120);
        ScheduleEntry second = completedCut(12L, LocalTime.of(7, 20), LocalTime.of(7, 25), 10, 10);
        Schedule current = Schedule.builder().id(7L).orderId(1L).startDate(MONDAY)
                .entries(new ArrayList<>(List.of(first, second))).build();
        when(scheduleRepository.findById(7L)).thenReturn(Optional.of(current));

        ScheduleResult result = service.replan(7L, MONDAY.plusDays(1), ReplanConstraints.none());

        List<ScheduleEntry> cutting = result.schedule().getEntries().stream()
                .filter(e -> e.getStepId() == 1L).toList();
        assertThat(cutting).hasSize(2);
        assertThat(cutting.stream().mapToInt(ScheduleEntry::getPlannedOutput).sum()).isEqualTo(100);
        assertThat(cutting).extracting(ScheduleEntry::getPlannedOutput).containsExactly(100, 0);
        assertThat(cutting).extracting(ScheduleEntry::getActualOutput).containsExactly(120, 10);
        assertThat(cutting.get(0).getAssignments()).extracting(Assignment::getPlannedOutput).containsExactly(100);
        assertThat(result.schedule().getEntries()).filteredOn(e -> e.getStepId() == 2L)
                .extracting(ScheduleEntry::getPlannedOutput).containsExactly(100);
    }

    @Test
    void previewReplan_returnsDraftWithoutSaving() {
        ScheduleEntry cutDone = completedCut(10L, LocalTime.of(7, 0), LocalTime.of(7, 20), 100, 100);
        Schedule current = Schedule.builder().id(7L).orderId(1L).startDate(MONDAY)
                .entries(new ArrayList<>(List.of(cutDone))).build();
        when(scheduleRepository.findById(7L)).thenReturn(Optional.of(current));

        ReplanDraft draft = service.previewReplan(7L, MONDAY.plusDays(1), null);

        assertThat(draft.sourceScheduleId()).isEqualTo(7L);
        assertThat(draft.orderId()).isEqualTo(1L);
        assertThat(draft.startDate()).isEqualTo(MONDAY.plusDays(1));
        assertThat(draft.totalOutput()).isEqualTo(100);
        assertThat(draft.completedOutput()).isZero();
        assertThat(draft.remainingOutput()).isEqualTo(100);
        assertThat(draft.canMeetDeadline()).isTrue();
        assertThat(draft.entries()).extracting(ScheduleEntry::getStepId).containsExactly(1L, 2L);
        assertThat(draft.entries()).allSatisfy(e -> assertThat(e.getId()).isNull());
        verify(scheduleRepository, never()).replaceSchedule(any(), any());
        verify(orderRepository, never()).updateStatus(any(), any());
        assertThat(locks.orders().isLocked(1L)).isFalse();
    }

    @Test
    void previewReplan_matchesWhatReplanSaves() {
        ScheduleEntry cutDone = completedCut(10L, LocalTime.of(7, 0), LocalTime.of(7, 20), 100, 100);
        Schedule current = Schedule.builder().id(7L).orderId(1L).startDate(MONDAY)
                .entries(new ArrayList<>(List.of(cutDone))).build();
        when(scheduleRepository.findById(7L)).thenReturn(Optional.of(current));

        ReplanDraft draft = service.previewReplan(7L, MONDAY.plusDays(1), ReplanConstraints.none());
        ScheduleResult committed = service.replan(7L, MONDAY.plusDays(1), ReplanConstraints.none());

        assertThat(committed.schedule().getEntries())
                .extracting(ScheduleEntry::getStepId, ScheduleEntry::getWorkDate,
                        ScheduleEntry::getStartTime, ScheduleEntry::getPlannedOutput)
                .containsExactlyElementsOf(draft.entries().stream()
                        .map(e -> tuple(e.getStepId(), e.getWorkDate(), e.getStartTime(), e.getPlannedOutput()))
                        .toList());
    }

    @Test
    void previewReplan_unknownScheduleIsNotFound() {
        assertThatThrownBy(() -> service.previewReplan(99L, MONDAY, null)).isInstanceOf(NotFoundException.class);
    }

    @Test
    void replan_excludedWorkersAreNotAssigned() {
        Schedule current = Schedule.builder().id(7L).orderId(1L).startDate(MONDAY).entries(new ArrayList<>()).build();
        when(scheduleRepository.findById(7L)).thenReturn(Optional.of(current));

        ScheduleResult result = service.replan(7L, MONDAY, new ReplanConstraints(Set.of(2L), null));

        ArgumentCaptor<Schedule> saved = ArgumentCaptor.forClass(Schedule.class);
        verify(scheduleRepository).replaceSchedule(eq(1L), saved.capture());
        assertThat(saved.getValue().getEntries()).filteredOn(e -> e.getStepId() == 2L)
                .allSatisfy(e -> assertThat(e.isAssigned()).isFalse());
        assertThat(result.warnings()).extracting(ScheduleWarning::getCode)
                .containsExactly(WarningCode.NO_ELIGIBLE_WORKER);
    }

    @Test
    void rekey_reapportionsAssignmentsToActualOutput() {
        ScheduleEntry done = ScheduleEntry.builder().id(10L).stepId(1L).plannedOutput(100).actualOutput(91)
                .assignments(List.of(
                        Assignment.builder().workerId(1L).plannedOutput(60).build(),
                        Assignment.builder().workerId(2L).plannedOutput(40).build()))
                .build();

        ScheduleEntry moved = ScheduleGenerationService.rekey(done, 91);

        assertThat(moved.getPlannedOutput()).isEqualTo(91);
        assertThat(moved.getAssignments()).extracting(Assignment::getPlannedOutput).containsExactly(55, 36);
        assertThat(done.getAssignments()).extracting(Assignment::getPlannedOutput).containsExactly(60, 40);
    }

    @Test
    void roundUp_movesToNextSlotBoundary() {
        assertThat(ScheduleGenerationService.roundUp(LocalDateTime.of(2026, 10, 19, 10, 7, 30), 15))
                .isEqualTo(LocalDateTime.of(2026, 10, 19, 10, 15));
        assertThat(ScheduleGenerationService.roundUp(LocalDateTime.of(2026, 10, 19, 10, 15), 15))
                .isEqualTo(LocalDateTime.of(2026, 10, 19, 10, 15));
        assertThat(ScheduleGenerationService.roundUp(LocalDateTime.of(2026, 10, 19, 10, 50), 15))
                .isEqualTo(LocalDateTime.of(2026, 10, 19, 11, 0));
    }

    private static ScheduleEntry completedCut(long id, LocalTime start, LocalTime end, int planned, int actual) {
        return ScheduleEntry.builder().id(id).scheduleId(7L).stepId(1L).workDate(MONDAY)
                .startTime(start).endTime(end).plannedOutput(planned)
                .actualStartTime(start).actualEndTime(end).actualOutput(actual)
                .status(EntryStatus.COMPLETED)
                .assignments(new ArrayList<>(List.of(
                        Assignment.builder().entryId(id).workerId(1L).plannedOutput(planned).build())))
                .build();
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
