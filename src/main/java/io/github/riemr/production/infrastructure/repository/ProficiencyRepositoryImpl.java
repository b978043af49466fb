package io.github.riemr.production.infrastructure.repository;

import io.github.riemr.production.application.repository.ProficiencyRepository;
import io.github.riemr.production.domain.model.Proficiency;
import io.github.riemr.production.domain.model.ProficiencyHistory;
import io.github.riemr.production.infrastructure.mapper.ProficiencyMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class ProficiencyRepositoryImpl implements ProficiencyRepository {
    private final ProficiencyMapper mapper;

    public ProficiencyRepositoryImpl(ProficiencyMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public Optional<Proficiency> find(Long workerId, Long stepId) {
        return Optional.ofNullable(mapper.selectByPrimaryKey(workerId, stepId));
    }

    @Override
    public boolean insert(Proficiency proficiency) {
        return mapper.insert(proficiency) == 1;
    }

    @Override
    public boolean updateProficiency(Long workerId, Long stepId, int newLevel, long expectedVersion) {
        return mapper.updateLevel(workerId, stepId, newLevel, expectedVersion) == 1;
    }

    @Override
    public void appendHistory(ProficiencyHistory history) {
        mapper.insertHistory(history);
    }

    @Override
    public List<ProficiencyHistory> findHistoryByWorker(Long workerId, int limit) {
        return mapper.selectHistoryByWorker(workerId, limit);
    }
}
