package io.github.riemr.production.application.service;

import io.github.riemr.production.application.dto.ScheduleView;
import io.github.riemr.production.application.repository.ScheduleRepository;
import io.github.riemr.production.domain.exception.NotFoundException;
import io.github.riemr.production.domain.model.Schedule;
import io.github.riemr.production.domain.model.ScheduleEntry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ScheduleQueryService {

    private final ScheduleRepository scheduleRepository;

    public ScheduleView getSchedule(Long scheduleId) {
        return toView(scheduleRepository.findById(scheduleId)
                .orElseThrow(() -> new NotFoundException("Schedule", scheduleId)));
    }

    public ScheduleView getScheduleByOrder(Long orderId) {
        return toView(scheduleRepository.findByOrderId(orderId)
                .orElseThrow(() -> new NotFoundException("Schedule for order", orderId)));
    }

    static ScheduleView toView(Schedule schedule) {
        Map<LocalDate, List<ScheduleEntry>> byDate = new TreeMap<>();
        for (ScheduleEntry e : schedule.getEntries()) {
            byDate.computeIfAbsent(e.getWorkDate(), d -> new ArrayList<>()).add(e);
        }
        List<ScheduleView.Day> days = new ArrayList<>();
        byDate.forEach((date, entries) -> days.add(new ScheduleView.Day(date,
                entries.stream().mapToInt(e -> e.getPlannedOutput() == null ? 0 : e.getPlannedOutput()).sum(),
                entries)));
        return new ScheduleView(schedule.getId(), schedule.getOrderId(), schedule.getStartDate(), days);
    }
}
