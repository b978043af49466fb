package io.github.riemr.production.infrastructure.repository;

import io.github.riemr.production.application.repository.ScheduleRepository;
import io.github.riemr.production.domain.model.Assignment;
import io.github.riemr.production.domain.model.Schedule;
import io.github.riemr.production.domain.model.ScheduleEntry;
import io.github.riemr.production.infrastructure.mapper.ScheduleEntryMapper;
import io.github.riemr.production.infrastructure.mapper.ScheduleMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@Repository
@Slf4j
public class ScheduleRepositoryImpl implements ScheduleRepository {
    private final ScheduleMapper scheduleMapper;
    private final ScheduleEntryMapper entryMapper;

    public ScheduleRepositoryImpl(ScheduleMapper scheduleMapper, ScheduleEntryMapper entryMapper) {
        this.scheduleMapper = scheduleMapper;
        this.entryMapper = entryMapper;
    }

    @Override
    public Optional<Schedule> findById(Long scheduleId) {
        return Optional.ofNullable(scheduleMapper.selectByPrimaryKey(scheduleId)).map(this::withEntries);
    }

    @Override
    public Optional<Schedule> findByOrderId(Long orderId) {
        return Optional.ofNullable(scheduleMapper.selectByOrderId(orderId)).map(this::withEntries);
    }

    @Override
    @Transactional
    public Schedule replaceSchedule(Long orderId, Schedule schedule) {
        int removed = scheduleMapper.deleteByOrderId(orderId);
        schedule.setOrderId(orderId);
        scheduleMapper.insert(schedule);
        for (ScheduleEntry entry : schedule.getEntries()) {
            entry.setScheduleId(schedule.getId());
            entry.setOrderId(orderId);
            entryMapper.insert(entry);
            for (Assignment a : entry.getAssignments()) {
                a.setEntryId(entry.getId());
                entryMapper.insertAssignment(a);
            }
        }
        log.debug("Replaced schedule for order {} (removed {}), new id {}", orderId, removed, schedule.getId());
        return schedule;
    }

    @Override
    public Optional<ScheduleEntry> findEntry(Long entryId) {
        ScheduleEntry entry = entryMapper.selectByPrimaryKey(entryId);
        if (entry == null) return Optional.empty();
        attachAssignments(List.of(entry));
        return Optional.of(entry);
    }

    @Override
    public void updateEntryActuals(ScheduleEntry entry) {
        entryMapper.updateActuals(entry);
    }

    @Override
    public int countIncompleteEntries(Long orderId) {
        return entryMapper.countIncomplete(orderId);
    }

    @Override
    public List<ScheduleEntry> findEntriesByOrderIds(Collection<Long> orderIds) {
        if (orderIds.isEmpty()) return List.of();
        return attachAssignments(entryMapper.selectByOrderIds(orderIds));
    }

    @Override
    public List<ScheduleEntry> findCompletedEntriesSince(LocalDate since) {
        return attachAssignments(entryMapper.selectCompletedSince(since));
    }

    @Override
    public List<ScheduleEntry> findCompletedEntries(Long workerId, Long stepId, LocalDate since) {
        return attachAssignments(entryMapper.selectCompletedByWorkerAndStep(workerId, stepId, since));
    }

    @Override
    public List<ScheduleEntry> findCompletedEntriesByWorker(Long workerId) {
        return attachAssignments(entryMapper.selectCompletedByWorker(workerId));
    }

    private Schedule withEntries(Schedule schedule) {
        schedule.setEntries(attachAssignments(entryMapper.selectBySchedule(schedule.getId())));
        return schedule;
    }

    private List<ScheduleEntry> attachAssignments(List<ScheduleEntry> entries) {
        if (entries.isEmpty()) return entries;
        List<Long> ids = entries.stream().map(ScheduleEntry::getId).toList();
        Map<Long, List<Assignment>> byEntry = entryMapper.selectAssignmentsByEntryIds(ids).stream()
                .collect(Collectors.groupingBy(Assignment::getEntryId));
        for (ScheduleEntry e : entries) {
            e.setAssignments(new ArrayList<>(byEntry.getOrDefault(e.getId(), List.of())));
        }
        return entries;
    }
}
