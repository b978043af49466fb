package io.github.riemr.production.planning.feedback;

import io.github.riemr.production.domain.model.Assignment;
import io.github.riemr.production.domain.model.ProficiencyChangeReason;
import io.github.riemr.production.domain.model.ProductStep;
import io.github.riemr.production.domain.model.ScheduleEntry;
import io.github.riemr.production.domain.model.StepCategory;
import org.junit.jupiter.api.Test;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static io.github.riemr.production.Fixtures.MONDAY;
import static io.github.riemr.production.Fixtures.step;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class EfficiencyEvaluatorTest {

    private final EfficiencyEvaluator evaluator = new EfficiencyEvaluator(120, 80, 10, 5, 30);
    private final ProductStep sew = step(20, 1, StepCategory.SEWING, 60);

    private static ScheduleEntry completed(int output, LocalTime start, LocalTime end, long... workers) {
        List<Assignment> crew = new ArrayList<>();
        for (long w : workers) crew.add(Assignment.builder().workerId(w).plannedOutput(output / workers.length).build());
        return ScheduleEntry.builder().stepId(20L).workDate(MONDAY).plannedOutput(output)
                .startTime(start).endTime(end).actualStartTime(start).actualEndTime(end).actualOutput(output)
                .assignments(crew).build();
    }

    @Test
    void entryEfficiency_comparesStandardToActualMinutes() {
        ScheduleEntry solo = completed(60, LocalTime.of(7, 0), LocalTime.of(9, 0), 7);
        ScheduleEntry pair = completed(60, LocalTime.of(7, 0), LocalTime.of(9, 0), 7, 8);

        assertThat(evaluator.entryEfficiency(solo, sew).getAsDouble()).isCloseTo(50.0, within(1e-9));
        assertThat(evaluator.entryEfficiency(pair, sew).getAsDouble()).isCloseTo(25.0, within(1e-9));
    }

    @Test
    void entryEfficiency_isEmptyWithoutActualWindow() {
        ScheduleEntry entry = completed(60, LocalTime.of(7, 0), LocalTime.of(9, 0), 7);
        entry.setActualStartTime(null);

        assertThat(evaluator.entryEfficiency(entry, sew)).isEmpty();
    }

    @Test
    void evaluate_needsMinimumSamples() {
        assertThat(evaluator.evaluate(7L, 20L, 3, List.of(50.0, 50.0, 50.0, 50.0))).isEmpty();
    }

    @Test
    void evaluate_raisesLevelAboveHighThreshold() {
        Optional<ProficiencyAdjustment> adj = evaluator.evaluate(7L, 20L, 3, Collections.nCopies(5, 130.0));

        assertThat(adj).hasValueSatisfying(a -> {
            assertThat(a.getNewLevel()).isEqualTo(4);
            assertThat(a.getReason()).isEqualTo(ProficiencyChangeReason.AUTO_INCREASE);
            assertThat(a.getAvgEfficiency()).isEqualTo(130.0);
            assertThat(a.getSampleSize()).isEqualTo(5);
        });
    }

    @Test
    void evaluate_keepsLevelWithinBounds() {
        assertThat(evaluator.evaluate(7L, 20L, 1, Collections.nCopies(5, 50.0))).isEmpty();
        assertThat(evaluator.evaluate(7L, 20L, 5, Collections.nCopies(5, 150.0))).isEmpty();
        assertThat(evaluator.evaluate(7L, 20L, 3, Collections.nCopies(5, 100.0))).isEmpty();
    }

    @Test
    void evaluate_usesOnlyNewestWindow() {
        List<Double> samples = new ArrayList<>(Collections.nCopies(10, 50.0));
        samples.addAll(Collections.nCopies(5, 300.0));

        Optional<ProficiencyAdjustment> adj = evaluator.evaluate(7L, 20L, 3, samples);

        assertThat(adj).hasValueSatisfying(a -> {
            assertThat(a.getReason()).isEqualTo(ProficiencyChangeReason.AUTO_DECREASE);
            assertThat(a.getSampleSize()).isEqualTo(10);
        });
    }
}
