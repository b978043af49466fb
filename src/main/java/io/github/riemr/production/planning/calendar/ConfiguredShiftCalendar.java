package io.github.riemr.production.planning.calendar;

import io.github.riemr.production.config.ShiftCalendarProperties;
import io.github.riemr.production.domain.exception.ErrorCode;
import io.github.riemr.production.domain.exception.ValidationException;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@link ShiftCalendarProperties} から組み立てる勤務カレンダー。
 */
public class ConfiguredShiftCalendar implements ShiftCalendar {

    private final LocalTime dayStart;
    private final LocalTime dayEnd;
    private final List<Break> breaks;
    private final Set<DayOfWeek> workingDays;
    private final Set<LocalDate> holidays;

    public ConfiguredShiftCalendar(ShiftCalendarProperties props) {
        this.dayStart = LocalTime.parse(props.getDayStart());
        this.dayEnd = LocalTime.parse(props.getDayEnd());
        if (!dayEnd.isAfter(dayStart)) {
            throw new IllegalArgumentException("day-end must be after day-start: " + dayStart + "-" + dayEnd);
        }
        this.breaks = props.getBreaks().stream()
                .map(w -> new Break(LocalTime.parse(w.getStart()), LocalTime.parse(w.getEnd())))
                .peek(b -> {
                    if (!b.end.isAfter(b.start) || b.start.isBefore(dayStart) || b.end.isAfter(dayEnd)) {
                        throw new IllegalArgumentException("Break outside shift: " + b.start + "-" + b.end);
                    }
                })
                .sorted(Comparator.comparing((Break b) -> b.start))
                .toList();
        this.workingDays = props.getWorkingDays().isEmpty()
                ? EnumSet.noneOf(DayOfWeek.class)
                : EnumSet.copyOf(props.getWorkingDays());
        this.holidays = props.getHolidays().stream().map(LocalDate::parse).collect(Collectors.toSet());
    }

    @Override
    public boolean isWorkingDay(LocalDate date) {
        return workingDays.contains(date.getDayOfWeek()) && !holidays.contains(date);
    }

    @Override
    public double shiftHours(LocalDate date) {
        if (!isWorkingDay(date)) return 0;
        return workSeconds(dayStart, dayEnd) / 3600.0;
    }

    @Override
    public LocalDateTime nextOpenSlot(LocalDateTime from) {
        LocalDate date = from.toLocalDate();
        for (int i = 0; i <= SEARCH_LIMIT_DAYS; i++, date = date.plusDays(1)) {
            if (!isWorkingDay(date)) continue;
            LocalTime t = i == 0 && from.toLocalTime().isAfter(dayStart) ? from.toLocalTime() : dayStart;
            for (Break b : breaks) {
                if (!t.isBefore(b.start) && t.isBefore(b.end)) t = b.end;
            }
            if (t.isBefore(dayEnd)) {
                return date.atTime(t);
            }
        }
        throw new ValidationException(ErrorCode.NO_WORKING_DAYS,
                "No working day within " + SEARCH_LIMIT_DAYS + " days of " + from.toLocalDate());
    }

    @Override
    public long workSecondsUntilShiftEnd(LocalDateTime slot) {
        if (!isWorkingDay(slot.toLocalDate())) return 0;
        return workSeconds(slot.toLocalTime(), dayEnd);
    }

    @Override
    public long workSecondsBetween(LocalDateTime from, LocalDateTime to) {
        long total = 0;
        for (LocalDate d = from.toLocalDate(); !d.isAfter(to.toLocalDate()); d = d.plusDays(1)) {
            if (!isWorkingDay(d)) continue;
            LocalTime a = d.equals(from.toLocalDate()) ? from.toLocalTime() : LocalTime.MIN;
            LocalTime b = d.equals(to.toLocalDate()) ? to.toLocalTime() : dayEnd;
            total += workSeconds(a, b);
        }
        return total;
    }

    @Override
    public LocalDateTime advance(LocalDateTime slot, long seconds) {
        LocalTime t = slot.toLocalTime();
        long left = seconds;
        for (Break b : breaks) {
            if (!t.isBefore(b.end)) continue;
            if (!t.isBefore(b.start)) {
                t = b.end;
                continue;
            }
            long untilBreak = Duration.between(t, b.start).getSeconds();
            if (left <= untilBreak) {
                return slot.toLocalDate().atTime(t.plusSeconds(left));
            }
            left -= untilBreak;
            t = b.end;
        }
        long untilEnd = Math.max(0, Duration.between(t, dayEnd).getSeconds());
        return slot.toLocalDate().atTime(t.plusSeconds(Math.min(left, untilEnd)));
    }

    /** 同日内 [from, to) の休憩を除いた秒数。シフト外はクリップする。 */
    private long workSeconds(LocalTime from, LocalTime to) {
        LocalTime a = from.isBefore(dayStart) ? dayStart : from;
        LocalTime b = to.isAfter(dayEnd) ? dayEnd : to;
        if (!b.isAfter(a)) return 0;
        long total = Duration.between(a, b).getSeconds();
        for (Break br : breaks) {
            LocalTime s = br.start.isAfter(a) ? br.start : a;
            LocalTime e = br.end.isBefore(b) ? br.end : b;
            if (e.isAfter(s)) total -= Duration.between(s, e).getSeconds();
        }
        return total;
    }

    private static final class Break {
        final LocalTime start;
        final LocalTime end;

        Break(LocalTime start, LocalTime end) {
            this.start = start;
            this.end = end;
        }
    }
}
