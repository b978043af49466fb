package io.github.riemr.production.application.service;

import io.github.riemr.production.application.repository.ProductRepository;
import io.github.riemr.production.application.repository.ProficiencyRepository;
import io.github.riemr.production.application.repository.ScheduleRepository;
import io.github.riemr.production.domain.exception.ConcurrencyConflictException;
import io.github.riemr.production.domain.exception.NotFoundException;
import io.github.riemr.production.domain.exception.PersistenceFailureException;
import io.github.riemr.production.domain.model.Assignment;
import io.github.riemr.production.domain.model.Proficiency;
import io.github.riemr.production.domain.model.ProficiencyHistory;
import io.github.riemr.production.domain.model.ProductStep;
import io.github.riemr.production.domain.model.ScheduleEntry;
import io.github.riemr.production.planning.catalog.ProficiencyKey;
import io.github.riemr.production.planning.feedback.EfficiencyEvaluator;
import io.github.riemr.production.planning.feedback.ProficiencyAdjustment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.TreeSet;

/**
 * 完了実績から作業者 × 工程の習熟度を自動調整する。
 * <p>
 * 同じ作業者 × 工程の評価は直列化し、更新はバージョンによる楽観ロックで行う。
 * 評価対象は前回の習熟度変更より後に完了したエントリのみ。
 * </p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EfficiencyFeedbackService {

    private final ScheduleRepository scheduleRepository;
    private final ProductRepository productRepository;
    private final ProficiencyRepository proficiencyRepository;
    private final EfficiencyEvaluator evaluator;
    private final SchedulingLocks locks;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    /**
     * 完了したエントリの割当作業者ごとに評価し、変更があれば履歴を返す。
     */
    public List<ProficiencyHistory> onEntryCompleted(ScheduleEntry entry) {
        if (!entry.isCompleted() || !entry.isAssigned()) {
            return List.of();
        }
        ProductStep step = productRepository.findStep(entry.getStepId())
                .orElseThrow(() -> new NotFoundException("Step", entry.getStepId()));
        List<ProficiencyHistory> changes = new ArrayList<>();
        entry.getAssignments().stream()
                .map(Assignment::getWorkerId)
                .sorted()
                .forEach(workerId -> locks.proficiencies().withLock(new ProficiencyKey(workerId, step.getId()),
                        () -> assess(workerId, step).map(this::apply)).ifPresent(changes::add));
        return changes;
    }

    /** 直近に実績のある全ペアを評価する（更新はしない）。 */
    public List<ProficiencyAdjustment> previewAdjustments() {
        List<ProficiencyAdjustment> result = new ArrayList<>();
        forEachRecentPair((workerId, step) -> assess(workerId, step).ifPresent(result::add));
        return result;
    }

    /** 直近に実績のある全ペアを評価し、調整を適用する。 */
    public List<ProficiencyHistory> recalculateAll() {
        List<ProficiencyHistory> result = new ArrayList<>();
        forEachRecentPair((workerId, step) -> locks.proficiencies()
                .withLock(new ProficiencyKey(workerId, step.getId()), () -> assess(workerId, step).map(this::apply))
                .ifPresent(result::add));
        log.info("Proficiency recalculation applied {} changes", result.size());
        return result;
    }

    Optional<ProficiencyAdjustment> assess(Long workerId, ProductStep step) {
        Optional<Proficiency> current = proficiencyRepository.find(workerId, step.getId());
        int level = current.map(Proficiency::getLevel).orElse(Proficiency.DEFAULT_LEVEL);
        LocalDateTime lastChange = current.map(Proficiency::getUpdatedAt).orElse(null);

        LocalDate since = LocalDate.now(clock).minusDays(evaluator.getLookbackDays());
        List<Double> samples = new ArrayList<>();
        for (ScheduleEntry e : scheduleRepository.findCompletedEntries(workerId, step.getId(), since)) {
            if (samples.size() >= evaluator.getWindowSize()) break;
            if (lastChange != null && (e.completedAt() == null || !e.completedAt().isAfter(lastChange))) continue;
            OptionalDouble efficiency = evaluator.entryEfficiency(e, step);
            if (efficiency.isPresent()) samples.add(efficiency.getAsDouble());
        }
        Optional<ProficiencyAdjustment> adjustment = evaluator.evaluate(workerId, step.getId(), level, samples);
        log.debug("Assessed worker={} step={}: level={}, samples={}, adjustment={}",
                workerId, step.getId(), level, samples.size(), adjustment.orElse(null));
        return adjustment;
    }

    private ProficiencyHistory apply(ProficiencyAdjustment adj) {
        LocalDateTime now = LocalDateTime.now(clock);
        ProficiencyHistory history = ProficiencyHistory.builder()
                .workerId(adj.getWorkerId())
                .stepId(adj.getStepId())
                .oldLevel(adj.getCurrentLevel())
                .newLevel(adj.getNewLevel())
                .reason(adj.getReason())
                .avgEfficiency(adj.getAvgEfficiency())
                .sampleSize(adj.getSampleSize())
                .createdAt(now)
                .build();
        try {
            transactionTemplate.executeWithoutResult(status -> {
                Optional<Proficiency> current = proficiencyRepository.find(adj.getWorkerId(), adj.getStepId());
                boolean ok;
                if (current.isPresent()) {
                    ok = current.get().getLevel() == adj.getCurrentLevel()
                            && proficiencyRepository.updateProficiency(adj.getWorkerId(), adj.getStepId(),
                                    adj.getNewLevel(), current.get().getVersion());
                } else {
                    ok = proficiencyRepository.insert(Proficiency.builder()
                            .workerId(adj.getWorkerId())
                            .stepId(adj.getStepId())
                            .level(adj.getNewLevel())
                            .version(0L)
                            .updatedAt(now)
                            .build());
                }
                if (!ok) {
                    throw new ConcurrencyConflictException(
                            "Proficiency " + adj.getWorkerId() + ":" + adj.getStepId() + " was modified concurrently");
                }
                proficiencyRepository.appendHistory(history);
            });
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to update proficiency " + adj.getWorkerId() + ":" + adj.getStepId(), e);
        }
        log.info("Proficiency {} worker={} step={}: {} -> {} (avg {}%, n={})", adj.getReason(),
                adj.getWorkerId(), adj.getStepId(), adj.getCurrentLevel(), adj.getNewLevel(),
                adj.getAvgEfficiency(), adj.getSampleSize());
        return history;
    }

    private void forEachRecentPair(PairAction action) {
        LocalDate since = LocalDate.now(clock).minusDays(evaluator.getLookbackDays());
        TreeSet<ProficiencyKey> pairs = new TreeSet<>(Comparator.comparing(ProficiencyKey::getWorkerId)
                .thenComparing(ProficiencyKey::getStepId));
        for (ScheduleEntry e : scheduleRepository.findCompletedEntriesSince(since)) {
            for (Assignment a : e.getAssignments()) {
                pairs.add(new ProficiencyKey(a.getWorkerId(), e.getStepId()));
            }
        }
        Map<Long, Optional<ProductStep>> steps = new HashMap<>();
        for (ProficiencyKey key : pairs) {
            Optional<ProductStep> step = steps.computeIfAbsent(key.getStepId(), productRepository::findStep);
            if (step.isEmpty()) {
                log.warn("Skipping proficiency pair {}: step no longer exists", key);
                continue;
            }
            action.accept(key.getWorkerId(), step.get());
        }
    }

    @FunctionalInterface
    private interface PairAction {
        void accept(Long workerId, ProductStep step);
    }
}
