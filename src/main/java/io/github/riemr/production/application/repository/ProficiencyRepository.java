package io.github.riemr.production.application.repository;

import io.github.riemr.production.domain.model.Proficiency;
import io.github.riemr.production.domain.model.ProficiencyHistory;

import java.util.List;
import java.util.Optional;

public interface ProficiencyRepository {
    Optional<Proficiency> find(Long workerId, Long stepId);

    /** 新規登録。既に存在する場合は false。 */
    boolean insert(Proficiency proficiency);

    /**
     * expectedVersion と一致する場合のみ更新し version を進める。
     *
     * @return 更新できなければ false（他で更新済み）
     */
    boolean updateProficiency(Long workerId, Long stepId, int newLevel, long expectedVersion);

    void appendHistory(ProficiencyHistory history);

    List<ProficiencyHistory> findHistoryByWorker(Long workerId, int limit);
}
