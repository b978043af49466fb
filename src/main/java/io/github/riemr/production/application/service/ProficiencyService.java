package io.github.riemr.production.application.service;

import io.github.riemr.production.application.repository.ProductRepository;
import io.github.riemr.production.application.repository.ProficiencyRepository;
import io.github.riemr.production.application.repository.ResourceCatalogRepository;
import io.github.riemr.production.domain.exception.ConcurrencyConflictException;
import io.github.riemr.production.domain.exception.ErrorCode;
import io.github.riemr.production.domain.exception.NotFoundException;
import io.github.riemr.production.domain.exception.PersistenceFailureException;
import io.github.riemr.production.domain.exception.ValidationException;
import io.github.riemr.production.domain.model.Proficiency;
import io.github.riemr.production.domain.model.ProficiencyChangeReason;
import io.github.riemr.production.domain.model.ProficiencyHistory;
import io.github.riemr.production.planning.catalog.ProficiencyKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 習熟度の手動設定と履歴参照。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProficiencyService {

    static final int HISTORY_LIMIT = 50;

    private final ProficiencyRepository proficiencyRepository;
    private final ResourceCatalogRepository catalogRepository;
    private final ProductRepository productRepository;
    private final SchedulingLocks locks;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public Proficiency setProficiency(Long workerId, Long stepId, Integer level) {
        if (level == null || !Proficiency.isValidLevel(level)) {
            throw new ValidationException(ErrorCode.INVALID_LEVEL, "Proficiency level must be 1-5: " + level);
        }
        catalogRepository.findWorker(workerId).orElseThrow(() -> new NotFoundException("Worker", workerId));
        productRepository.findStep(stepId).orElseThrow(() -> new NotFoundException("Step", stepId));

        return locks.proficiencies().withLock(new ProficiencyKey(workerId, stepId), () -> {
            try {
                return transactionTemplate.execute(status -> save(workerId, stepId, level));
            } catch (DataAccessException e) {
                throw new PersistenceFailureException("Failed to set proficiency " + workerId + ":" + stepId, e);
            }
        });
    }

    public List<ProficiencyHistory> getHistory(Long workerId) {
        catalogRepository.findWorker(workerId).orElseThrow(() -> new NotFoundException("Worker", workerId));
        return proficiencyRepository.findHistoryByWorker(workerId, HISTORY_LIMIT);
    }

    private Proficiency save(Long workerId, Long stepId, int level) {
        LocalDateTime now = LocalDateTime.now(clock);
        Optional<Proficiency> current = proficiencyRepository.find(workerId, stepId);
        int oldLevel;
        Proficiency result;
        if (current.isPresent()) {
            oldLevel = current.get().getLevel();
            if (oldLevel == level) {
                return current.get();
            }
            if (!proficiencyRepository.updateProficiency(workerId, stepId, level, current.get().getVersion())) {
                throw new ConcurrencyConflictException("Proficiency " + workerId + ":" + stepId + " was modified concurrently");
            }
            result = current.get().toBuilder().level(level).version(current.get().getVersion() + 1).updatedAt(now).build();
        } else {
            oldLevel = Proficiency.DEFAULT_LEVEL;
            result = Proficiency.builder().workerId(workerId).stepId(stepId).level(level).version(0L).updatedAt(now).build();
            if (!proficiencyRepository.insert(result)) {
                throw new ConcurrencyConflictException("Proficiency " + workerId + ":" + stepId + " was created concurrently");
            }
        }
        if (oldLevel != level) {
            proficiencyRepository.appendHistory(ProficiencyHistory.builder()
                    .workerId(workerId)
                    .stepId(stepId)
                    .oldLevel(oldLevel)
                    .newLevel(level)
                    .reason(ProficiencyChangeReason.MANUAL)
                    .createdAt(now)
                    .build());
        }
        log.info("Proficiency set manually: worker={} step={} {} -> {}", workerId, stepId, oldLevel, level);
        return result;
    }
}
