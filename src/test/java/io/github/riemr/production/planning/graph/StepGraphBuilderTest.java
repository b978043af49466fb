package io.github.riemr.production.planning.graph;

import io.github.riemr.production.domain.exception.ErrorCode;
import io.github.riemr.production.domain.exception.GraphException;
import io.github.riemr.production.domain.exception.ValidationException;
import io.github.riemr.production.domain.model.ProductStep;
import io.github.riemr.production.domain.model.StepCategory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.github.riemr.production.Fixtures.step;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StepGraphBuilderTest {

    private final StepGraphBuilder builder = new StepGraphBuilder();

    @Test
    void ordersReadyStepsBySequenceThenId_regardlessOfDeclarationOrder() {
        ProductStep inspect = step(5, 4, StepCategory.INSPECTION, 5, 3L, 4L);
        ProductStep sew = step(3, 3, StepCategory.SEWING, 20, 1L);
        ProductStep print = step(4, 3, StepCategory.SILKSCREEN, 15, 1L);
        ProductStep cut = step(1, 1, StepCategory.CUTTING, 10);
        ProductStep prep = step(2, 2, StepCategory.PREP, 0);

        StepGraph graph = builder.build(List.of(inspect, sew, print, cut, prep));

        assertThat(graph.topologicalOrder()).extracting(ProductStep::getId).containsExactly(1L, 2L, 3L, 4L, 5L);
        assertThat(graph.predecessorsOf(5L)).containsExactlyInAnyOrder(3L, 4L);
        assertThat(graph.successorsOf(1L)).containsExactlyInAnyOrder(3L, 4L);
        assertThat(graph.indexOf(4L)).isEqualTo(3);
    }

    @Test
    void allowsDependencyOnLaterSequencedStep() {
        ProductStep first = step(1, 1, StepCategory.CUTTING, 10, 2L);
        ProductStep second = step(2, 2, StepCategory.PREP, 10);

        StepGraph graph = builder.build(List.of(first, second));

        assertThat(graph.topologicalOrder()).extracting(ProductStep::getId).containsExactly(2L, 1L);
    }

    @Test
    void rejectsSelfDependencyAsCycle() {
        assertThatThrownBy(() -> builder.build(List.of(step(1, 1, StepCategory.CUTTING, 10, 1L))))
                .isInstanceOf(GraphException.class)
                .extracting(e -> ((GraphException) e).getCode())
                .isEqualTo(ErrorCode.CYCLE);
    }

    @Test
    void rejectsCycleAndReportsInvolvedSteps() {
        List<ProductStep> steps = List.of(
                step(1, 1, StepCategory.CUTTING, 10),
                step(2, 2, StepCategory.PREP, 10, 1L, 3L),
                step(3, 3, StepCategory.SEWING, 10, 2L));

        assertThatThrownBy(() -> builder.build(steps))
                .isInstanceOfSatisfying(GraphException.class, e -> {
                    assertThat(e.getCode()).isEqualTo(ErrorCode.CYCLE);
                    assertThat(e.getStepIds()).containsExactly(2L, 3L);
                });
    }

    @Test
    void rejectsDanglingDependency() {
        assertThatThrownBy(() -> builder.build(List.of(step(1, 1, StepCategory.CUTTING, 10, 99L))))
                .isInstanceOfSatisfying(GraphException.class, e -> {
                    assertThat(e.getCode()).isEqualTo(ErrorCode.DANGLING_DEPENDENCY);
                    assertThat(e.getStepIds()).containsExactly(1L);
                });
    }

    @Test
    void rejectsNegativeTimePerPiece() {
        assertThatThrownBy(() -> builder.build(List.of(step(1, 1, StepCategory.CUTTING, -1))))
                .isInstanceOfSatisfying(ValidationException.class,
                        e -> assertThat(e.getCode()).isEqualTo(ErrorCode.MALFORMED_STEP));
    }

    @Test
    void emptyProductGivesEmptyGraph() {
        assertThat(builder.build(List.of()).isEmpty()).isTrue();
    }
}
