package io.github.riemr.production.planning.assignment;

import io.github.riemr.production.domain.model.Assignment;
import io.github.riemr.production.domain.model.ProductStep;
import io.github.riemr.production.domain.model.SkillCategory;
import io.github.riemr.production.domain.model.Worker;
import io.github.riemr.production.planning.catalog.ResourceSnapshot;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 工程エントリへの作業者割当。
 * <ul>
 *   <li>適格: ACTIVE、スキル区分が合う、設備工程ならその日に有効な認定を持つ</li>
 *   <li>クルー: 習熟度の高い順（同値は id 昇順）に最大 maxWorkersPerEntry 名</li>
 *   <li>按分: 重み level / timePerPiece の比例配分を切り捨て、端数は最上位の作業者へ</li>
 * </ul>
 */
public class WorkerAssignmentResolver {

    private final int maxWorkersPerEntry;
    private final boolean sewingWorkersAssistOtherSteps;

    public WorkerAssignmentResolver(int maxWorkersPerEntry, boolean sewingWorkersAssistOtherSteps) {
        if (maxWorkersPerEntry < 1) {
            throw new IllegalArgumentException("maxWorkersPerEntry must be >= 1");
        }
        this.maxWorkersPerEntry = maxWorkersPerEntry;
        this.sewingWorkersAssistOtherSteps = sewingWorkersAssistOtherSteps;
    }

    /** 習熟度ごとの作業時間倍率。1 が最も遅く 5 が最も速い。 */
    public static double timeMultiplier(int level) {
        switch (level) {
            case 1: return 1.5;
            case 2: return 1.25;
            case 4: return 0.85;
            case 5: return 0.7;
            default: return 1.0;
        }
    }

    public boolean isSkillCompatible(Worker worker, ProductStep step) {
        return canWorkGroup(worker, skillGroupOf(step));
    }

    /** OTHER は完全一致。SEWING の作業者が他工程を手伝うのは設定で有効にした場合のみ。 */
    public boolean canWorkGroup(Worker worker, SkillCategory group) {
        if (group == SkillCategory.SEWING) {
            return worker.getSkillCategory() == SkillCategory.SEWING;
        }
        return worker.getSkillCategory() == SkillCategory.OTHER
                || (sewingWorkersAssistOtherSteps && worker.getSkillCategory() == SkillCategory.SEWING);
    }

    public static SkillCategory skillGroupOf(ProductStep step) {
        return step.isSewing() ? SkillCategory.SEWING : SkillCategory.OTHER;
    }

    public List<Worker> eligibleWorkers(ProductStep step, LocalDate date, ResourceSnapshot snapshot) {
        List<Worker> eligible = new ArrayList<>();
        for (Worker w : snapshot.getActiveWorkers()) {
            if (!isSkillCompatible(w, step)) continue;
            if (step.getEquipmentId() != null && !snapshot.isCertified(w.getId(), step.getEquipmentId(), date)) continue;
            eligible.add(w);
        }
        return eligible;
    }

    public Crew resolveCrew(ProductStep step, LocalDate date, ResourceSnapshot snapshot) {
        List<CrewMember> members = eligibleWorkers(step, date, snapshot).stream()
                .map(w -> new CrewMember(w.getId(), snapshot.proficiencyOf(w.getId(), step.getId())))
                .sorted(Comparator.comparingInt(CrewMember::getLevel).reversed()
                        .thenComparing(CrewMember::getWorkerId))
                .limit(maxWorkersPerEntry)
                .toList();
        return new Crew(members);
    }

    /**
     * エントリの計画出来高をクルーに按分する。合計は output に一致する。
     */
    public List<Assignment> apportion(int output, ProductStep step, Crew crew) {
        if (crew.isEmpty()) return List.of();
        int tpp = step.timePerPiece();
        List<CrewMember> members = crew.getMembers();
        double[] weights = new double[members.size()];
        double total = 0;
        for (int i = 0; i < members.size(); i++) {
            weights[i] = tpp > 0 ? (double) members.get(i).getLevel() / tpp : members.get(i).getLevel();
            total += weights[i];
        }

        int[] shares = new int[members.size()];
        int assigned = 0;
        for (int i = 0; i < members.size(); i++) {
            shares[i] = total > 0 ? (int) Math.floor(output * weights[i] / total + 1e-9) : 0;
            assigned += shares[i];
        }
        // クルーは習熟度降順・id 昇順なので先頭が最上位
        shares[0] += output - assigned;

        List<Assignment> result = new ArrayList<>(members.size());
        for (int i = 0; i < members.size(); i++) {
            result.add(Assignment.builder()
                    .workerId(members.get(i).getWorkerId())
                    .plannedOutput(shares[i])
                    .build());
        }
        return result;
    }
}
