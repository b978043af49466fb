package io.github.riemr.production.planning.catalog;

import io.github.riemr.production.domain.model.Certification;
import io.github.riemr.production.domain.model.Equipment;
import io.github.riemr.production.domain.model.Proficiency;
import io.github.riemr.production.domain.model.Worker;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 1 回の計画・分析で使う作業者/設備/認定/習熟度の不変スナップショット。
 * 呼び出しごとに取得し、処理中に外部の更新が見えないようにする。
 */
public final class ResourceSnapshot {
    private final LocalDateTime takenAt;
    private final List<Worker> activeWorkers;
    private final Map<Long, Equipment> equipmentById;
    private final Map<Long, List<Certification>> certificationsByWorker;
    private final Map<ProficiencyKey, Integer> levels;

    public ResourceSnapshot(LocalDateTime takenAt,
                            Collection<Worker> workers,
                            Collection<Equipment> equipment,
                            Collection<Certification> certifications,
                            Collection<Proficiency> proficiencies) {
        this.takenAt = takenAt;
        this.activeWorkers = workers.stream()
                .filter(Worker::isActive)
                .sorted(Comparator.comparing(Worker::getId))
                .toList();
        this.equipmentById = Map.copyOf(equipment.stream()
                .collect(Collectors.toMap(Equipment::getId, Function.identity())));
        Map<Long, List<Certification>> certs = new HashMap<>();
        for (Certification c : certifications) {
            certs.computeIfAbsent(c.getWorkerId(), k -> new ArrayList<>()).add(c);
        }
        certs.replaceAll((k, v) -> List.copyOf(v));
        this.certificationsByWorker = Map.copyOf(certs);
        Map<ProficiencyKey, Integer> lv = new HashMap<>();
        for (Proficiency p : proficiencies) {
            lv.put(new ProficiencyKey(p.getWorkerId(), p.getStepId()), p.getLevel());
        }
        this.levels = Map.copyOf(lv);
    }

    private ResourceSnapshot(ResourceSnapshot base, List<Worker> activeWorkers) {
        this.takenAt = base.takenAt;
        this.activeWorkers = activeWorkers;
        this.equipmentById = base.equipmentById;
        this.certificationsByWorker = base.certificationsByWorker;
        this.levels = base.levels;
    }

    public LocalDateTime getTakenAt() { return takenAt; }

    /** ACTIVE の作業者を id 昇順で返す。 */
    public List<Worker> getActiveWorkers() { return activeWorkers; }

    public Optional<Equipment> equipment(Long equipmentId) {
        return Optional.ofNullable(equipmentById.get(equipmentId));
    }

    /** 登録がなければ既定値 3。 */
    public int proficiencyOf(Long workerId, Long stepId) {
        return levels.getOrDefault(new ProficiencyKey(workerId, stepId), Proficiency.DEFAULT_LEVEL);
    }

    public boolean isCertified(Long workerId, Long equipmentId, LocalDate date) {
        return certificationsByWorker.getOrDefault(workerId, List.of()).stream()
                .anyMatch(c -> c.getEquipmentId().equals(equipmentId) && c.isValidOn(date));
    }

    /** 指定作業者を除外したスナップショット（再計画の制約用）。 */
    public ResourceSnapshot withoutWorkers(Set<Long> excluded) {
        if (excluded == null || excluded.isEmpty()) return this;
        return new ResourceSnapshot(this, activeWorkers.stream()
                .filter(w -> !excluded.contains(w.getId()))
                .toList());
    }
}
