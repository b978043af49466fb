package io.github.riemr.production.planning.graph;

import io.github.riemr.production.domain.exception.ErrorCode;
import io.github.riemr.production.domain.exception.GraphException;
import io.github.riemr.production.domain.exception.ValidationException;
import io.github.riemr.production.domain.model.ProductStep;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeSet;

/**
 * 製品工程から依存 DAG を構築する（Kahn 法）。
 * 実行可能な工程が複数あるときは sequence 昇順、同値なら id 昇順で取り出す。
 */
@Slf4j
public class StepGraphBuilder {

    static final Comparator<ProductStep> READY_ORDER =
            Comparator.comparing((ProductStep s) -> s.getSequence() == null ? Integer.MAX_VALUE : s.getSequence())
                    .thenComparing(ProductStep::getId);

    public StepGraph build(List<ProductStep> steps) {
        Map<Long, ProductStep> byId = new LinkedHashMap<>();
        for (ProductStep step : steps) {
            validate(step);
            if (byId.put(step.getId(), step) != null) {
                throw new ValidationException(ErrorCode.MALFORMED_STEP, "Duplicate step id " + step.getId());
            }
        }

        Map<Long, Set<Long>> predecessors = new HashMap<>();
        Map<Long, Set<Long>> successors = new HashMap<>();
        for (ProductStep step : byId.values()) {
            predecessors.put(step.getId(), new LinkedHashSet<>());
            successors.put(step.getId(), new LinkedHashSet<>());
        }
        for (ProductStep step : byId.values()) {
            Set<Long> deps = step.getDependencies() == null ? Set.of() : step.getDependencies();
            for (Long dep : deps) {
                if (dep.equals(step.getId())) {
                    throw GraphException.cycle(List.of(step.getId()));
                }
                if (!byId.containsKey(dep)) {
                    throw GraphException.dangling(step.getId(), dep);
                }
                predecessors.get(step.getId()).add(dep);
                successors.get(dep).add(step.getId());
            }
        }

        Map<Long, Integer> inDegree = new HashMap<>();
        predecessors.forEach((id, preds) -> inDegree.put(id, preds.size()));
        PriorityQueue<ProductStep> ready = new PriorityQueue<>(READY_ORDER);
        byId.values().stream().filter(s -> inDegree.get(s.getId()) == 0).forEach(ready::add);

        List<ProductStep> order = new ArrayList<>(byId.size());
        while (!ready.isEmpty()) {
            ProductStep next = ready.poll();
            order.add(next);
            for (Long succ : successors.get(next.getId())) {
                int remaining = inDegree.merge(succ, -1, Integer::sum);
                if (remaining == 0) ready.add(byId.get(succ));
            }
        }

        if (order.size() != byId.size()) {
            Set<Long> stuck = new TreeSet<>();
            inDegree.forEach((id, degree) -> { if (degree > 0) stuck.add(id); });
            throw GraphException.cycle(new ArrayList<>(stuck));
        }
        log.debug("Step graph built: {} steps, order={}", order.size(), order.stream().map(ProductStep::getId).toList());
        return new StepGraph(byId, predecessors, successors, order);
    }

    private static void validate(ProductStep step) {
        if (step.getId() == null) {
            throw new ValidationException(ErrorCode.MALFORMED_STEP, "Step without id");
        }
        if (step.getTimePerPieceSeconds() != null && step.getTimePerPieceSeconds() < 0) {
            throw new ValidationException(ErrorCode.MALFORMED_STEP,
                    "Negative time per piece on step " + step.getId());
        }
    }
}
