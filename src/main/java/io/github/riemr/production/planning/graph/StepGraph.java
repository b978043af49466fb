package io.github.riemr.production.planning.graph;

import io.github.riemr.production.domain.model.ProductStep;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 工程の依存関係 DAG とトポロジカル順序。生成後は不変。
 */
public final class StepGraph {
    private final Map<Long, ProductStep> stepsById;
    private final Map<Long, Set<Long>> predecessors;
    private final Map<Long, Set<Long>> successors;
    private final List<ProductStep> topologicalOrder;

    StepGraph(Map<Long, ProductStep> stepsById,
              Map<Long, Set<Long>> predecessors,
              Map<Long, Set<Long>> successors,
              List<ProductStep> topologicalOrder) {
        this.stepsById = Collections.unmodifiableMap(stepsById);
        this.predecessors = Collections.unmodifiableMap(predecessors);
        this.successors = Collections.unmodifiableMap(successors);
        this.topologicalOrder = List.copyOf(topologicalOrder);
    }

    public List<ProductStep> topologicalOrder() { return topologicalOrder; }

    public ProductStep step(Long stepId) { return stepsById.get(stepId); }

    public boolean contains(Long stepId) { return stepsById.containsKey(stepId); }

    public Set<Long> predecessorsOf(Long stepId) {
        return predecessors.getOrDefault(stepId, Set.of());
    }

    public Set<Long> successorsOf(Long stepId) {
        return successors.getOrDefault(stepId, Set.of());
    }

    /** トポロジカル順序上の位置。同時刻エントリの並び順に使う。 */
    public int indexOf(Long stepId) {
        for (int i = 0; i < topologicalOrder.size(); i++) {
            if (topologicalOrder.get(i).getId().equals(stepId)) return i;
        }
        return -1;
    }

    public int size() { return stepsById.size(); }

    public boolean isEmpty() { return stepsById.isEmpty(); }
}
