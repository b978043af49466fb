package io.github.riemr.production.planning.calendar;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 工場の勤務カレンダー。1 日 1 シフト、シフト内に休憩を含む。
 */
public interface ShiftCalendar {

    /** 非稼働日を探す上限日数 */
    int SEARCH_LIMIT_DAYS = 366;

    boolean isWorkingDay(LocalDate date);

    /** その日の実働時間（休憩除く）。非稼働日は 0。 */
    double shiftHours(LocalDate date);

    /**
     * 指定時刻以降で最初に作業可能な時刻。休憩中・始業前は次の作業可能時刻へ、
     * 終業後・非稼働日は翌稼働日の始業へ進める。
     *
     * @throws io.github.riemr.production.domain.exception.ValidationException
     *         {@value #SEARCH_LIMIT_DAYS} 日以内に稼働日がない場合
     */
    LocalDateTime nextOpenSlot(LocalDateTime from);

    /** slot から当日終業までの実働秒数。 */
    long workSecondsUntilShiftEnd(LocalDateTime slot);

    /** 区間 [from, to) に含まれる実働秒数。日をまたいでもよい。 */
    long workSecondsBetween(LocalDateTime from, LocalDateTime to);

    /**
     * slot から実働 seconds 秒進めた時刻。休憩は飛ばし、当日の終業を越えない。
     */
    LocalDateTime advance(LocalDateTime slot, long seconds);
}
