package io.github.riemr.production.application.repository;

import io.github.riemr.production.domain.model.Schedule;
import io.github.riemr.production.domain.model.ScheduleEntry;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface ScheduleRepository {
    Optional<Schedule> findById(Long scheduleId);
    Optional<Schedule> findByOrderId(Long orderId);

    /**
     * 受注のスケジュールを丸ごと置き換える。旧スケジュールの削除と新スケジュールの登録は 1 トランザクション。
     *
     * @return 採番済みの新スケジュール
     */
    Schedule replaceSchedule(Long orderId, Schedule schedule);

    Optional<ScheduleEntry> findEntry(Long entryId);
    void updateEntryActuals(ScheduleEntry entry);
    int countIncompleteEntries(Long orderId);

    /** 割当を含むエントリを受注ごとにまとめずに返す（orderId 設定済み）。 */
    List<ScheduleEntry> findEntriesByOrderIds(Collection<Long> orderIds);

    /** since 以降に作業日を持つ完了エントリ（割当付き）。 */
    List<ScheduleEntry> findCompletedEntriesSince(LocalDate since);

    /** 作業者 × 工程の完了エントリを新しい順に返す。 */
    List<ScheduleEntry> findCompletedEntries(Long workerId, Long stepId, LocalDate since);

    /** 作業者が割り当てられた完了エントリ（実績時間帯あり）を新しい順に返す。 */
    List<ScheduleEntry> findCompletedEntriesByWorker(Long workerId);
}
