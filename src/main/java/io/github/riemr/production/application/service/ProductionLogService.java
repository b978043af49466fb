package io.github.riemr.production.application.service;

import io.github.riemr.production.application.dto.CompletionResult;
import io.github.riemr.production.application.repository.OrderRepository;
import io.github.riemr.production.application.repository.ScheduleRepository;
import io.github.riemr.production.domain.exception.ErrorCode;
import io.github.riemr.production.domain.exception.NotFoundException;
import io.github.riemr.production.domain.exception.PersistenceFailureException;
import io.github.riemr.production.domain.exception.ValidationException;
import io.github.riemr.production.domain.model.EntryStatus;
import io.github.riemr.production.domain.model.Order;
import io.github.riemr.production.domain.model.OrderStatus;
import io.github.riemr.production.domain.model.ProficiencyHistory;
import io.github.riemr.production.domain.model.ScheduleEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * 現場からの作業開始・完了の記録。完了時は受注ステータスを進め、習熟度評価を起動する。
 * 記録は受注ロックの内側で行い、同じ受注の再計画と交互に走らないようにする。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProductionLogService {

    private final ScheduleRepository scheduleRepository;
    private final OrderRepository orderRepository;
    private final EfficiencyFeedbackService feedbackService;
    private final SchedulingLocks locks;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public ScheduleEntry recordStart(Long entryId, LocalTime actualStartTime) {
        Long orderId = loadOpenEntry(entryId).getOrderId();
        return locks.orders().withLock(orderId, () -> doRecordStart(entryId, actualStartTime));
    }

    private ScheduleEntry doRecordStart(Long entryId, LocalTime actualStartTime) {
        // 待っている間に再計画で置き換えられていれば NotFound
        ScheduleEntry entry = loadOpenEntry(entryId);
        entry.setActualStartTime(actualStartTime != null
                ? actualStartTime
                : LocalTime.now(clock).truncatedTo(ChronoUnit.MINUTES));
        entry.setStatus(EntryStatus.derive(entry.getActualStartTime(), entry.getActualEndTime(), entry.getActualOutput()));

        save(entry, () -> {
            Order order = loadOrder(entry.getOrderId());
            if (order.getStatus() == OrderStatus.SCHEDULED) {
                orderRepository.updateStatus(order.getId(), OrderStatus.IN_PROGRESS);
            }
        });
        log.info("Entry {} started at {}", entryId, entry.getActualStartTime());
        return entry;
    }

    /**
     * @param actualStartTime 開始が未記録の場合にのみ使う。どちらもなければ計画開始時刻
     */
    public CompletionResult recordCompletion(Long entryId, Integer actualOutput, LocalTime actualEndTime,
                                             LocalTime actualStartTime, String notes) {
        if (actualOutput == null || actualOutput < 0) {
            throw new ValidationException(ErrorCode.INVALID_QUANTITY, "Actual output must be >= 0: " + actualOutput);
        }
        if (actualEndTime == null) {
            throw new ValidationException(ErrorCode.INVALID_TIME_WINDOW, "Actual end time is required");
        }
        Long orderId = loadOpenEntry(entryId).getOrderId();
        ScheduleEntry entry = locks.orders().withLock(orderId,
                () -> doRecordCompletion(entryId, actualOutput, actualEndTime, actualStartTime, notes));
        log.info("Entry {} completed: output={}, {}-{}", entryId, actualOutput,
                entry.getActualStartTime(), actualEndTime);

        List<ProficiencyHistory> changes = feedbackService.onEntryCompleted(entry);
        return new CompletionResult(entry, changes);
    }

    private ScheduleEntry doRecordCompletion(Long entryId, Integer actualOutput, LocalTime actualEndTime,
                                             LocalTime actualStartTime, String notes) {
        ScheduleEntry entry = loadOpenEntry(entryId);
        LocalTime start = entry.getActualStartTime() != null ? entry.getActualStartTime()
                : actualStartTime != null ? actualStartTime
                : entry.getStartTime();
        if (!actualEndTime.isAfter(start)) {
            throw new ValidationException(ErrorCode.INVALID_TIME_WINDOW,
                    "Actual end " + actualEndTime + " is not after start " + start);
        }
        entry.setActualStartTime(start);
        entry.setActualEndTime(actualEndTime);
        entry.setActualOutput(actualOutput);
        if (notes != null) entry.setNotes(notes);
        entry.setStatus(EntryStatus.derive(start, actualEndTime, actualOutput));

        save(entry, () -> {
            Order order = loadOrder(entry.getOrderId());
            if (scheduleRepository.countIncompleteEntries(order.getId()) == 0) {
                orderRepository.updateStatus(order.getId(), OrderStatus.COMPLETED);
                log.info("Order {} completed", order.getId());
            } else if (order.getStatus() == OrderStatus.PENDING || order.getStatus() == OrderStatus.SCHEDULED) {
                orderRepository.updateStatus(order.getId(), OrderStatus.IN_PROGRESS);
            }
        });
        return entry;
    }

    private ScheduleEntry loadOpenEntry(Long entryId) {
        ScheduleEntry entry = scheduleRepository.findEntry(entryId)
                .orElseThrow(() -> new NotFoundException("ScheduleEntry", entryId));
        if (entry.isCompleted()) {
            throw new ValidationException(ErrorCode.ENTRY_ALREADY_COMPLETED, "Entry " + entryId + " is already completed");
        }
        return entry;
    }

    private Order loadOrder(Long orderId) {
        return orderRepository.findById(orderId).orElseThrow(() -> new NotFoundException("Order", orderId));
    }

    private void save(ScheduleEntry entry, Runnable afterUpdate) {
        try {
            transactionTemplate.executeWithoutResult(status -> {
                scheduleRepository.updateEntryActuals(entry);
                afterUpdate.run();
            });
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to record actuals for entry " + entry.getId(), e);
        }
    }
}
