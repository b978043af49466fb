package io.github.riemr.production.domain.exception;

import lombok.Getter;

import java.util.List;

/**
 * 工程依存グラフの構造エラー。code は {@link ErrorCode#CYCLE} か {@link ErrorCode#DANGLING_DEPENDENCY}。
 */
@Getter
public class GraphException extends SchedulingException {

    private static final long serialVersionUID = 1L;

    /** 問題のある工程 ID。 */
    private final List<Long> stepIds;

    public GraphException(ErrorCode code, List<Long> stepIds, String message) {
        super(code, message);
        this.stepIds = List.copyOf(stepIds);
    }

    public static GraphException cycle(List<Long> stepIds) {
        return new GraphException(ErrorCode.CYCLE, stepIds, "Cyclic step dependency among steps " + stepIds);
    }

    public static GraphException dangling(Long stepId, Long missingId) {
        return new GraphException(ErrorCode.DANGLING_DEPENDENCY, List.of(stepId),
                "Step " + stepId + " depends on unknown step " + missingId);
    }
}
