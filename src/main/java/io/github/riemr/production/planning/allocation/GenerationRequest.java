package io.github.riemr.production.planning.allocation;

import io.github.riemr.production.planning.catalog.ResourceSnapshot;
import io.github.riemr.production.planning.graph.StepGraph;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Map;

@Value
@Builder
public class GenerationRequest {
    StepGraph graph;
    int quantity;
    /** 工程ごとの残数量。未登録の工程は quantity 全量。 */
    @Builder.Default
    Map<Long, Integer> remainingByStep = Map.of();
    /** 完了済みエントリによる工程ごとの完了時刻（再計画時）。 */
    @Builder.Default
    Map<Long, LocalDateTime> completionAnchors = Map.of();
    LocalDateTime startAt;
    ResourceSnapshot snapshot;
    @Builder.Default
    GenerationDeadline deadline = GenerationDeadline.none();
    LocalDate dueDate;
}
