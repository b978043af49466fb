package io.github.riemr.production.planning.feedback;

import io.github.riemr.production.domain.model.Proficiency;
import io.github.riemr.production.domain.model.ProficiencyChangeReason;
import io.github.riemr.production.domain.model.ProductStep;
import io.github.riemr.production.domain.model.ScheduleEntry;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * 完了エントリの作業効率（%）と、それに基づく習熟度の増減判定。
 * <p>
 * 効率 = 標準分数 / 実績分数 × 100。標準分数は計画出来高 × 標準時間、
 * 実績分数は実績の作業時間帯 × 割当人数。
 * </p>
 */
public class EfficiencyEvaluator {

    private final double highThreshold;
    private final double lowThreshold;
    private final int windowSize;
    private final int minSamples;
    private final int lookbackDays;

    public EfficiencyEvaluator(double highThreshold, double lowThreshold,
                               int windowSize, int minSamples, int lookbackDays) {
        if (lowThreshold >= highThreshold) {
            throw new IllegalArgumentException("low threshold must be below high threshold");
        }
        this.highThreshold = highThreshold;
        this.lowThreshold = lowThreshold;
        this.windowSize = windowSize;
        this.minSamples = minSamples;
        this.lookbackDays = lookbackDays;
    }

    public int getWindowSize() { return windowSize; }
    public int getMinSamples() { return minSamples; }
    public int getLookbackDays() { return lookbackDays; }

    /** 実績時間帯が記録されていない、または 0 分のエントリは測定不能として空を返す。 */
    public OptionalDouble entryEfficiency(ScheduleEntry entry, ProductStep step) {
        int crew = Math.max(1, entry.getAssignments() == null ? 0 : entry.getAssignments().size());
        double actualMinutes = entry.actualMinutes() * crew;
        if (actualMinutes <= 0 || entry.getPlannedOutput() == null) {
            return OptionalDouble.empty();
        }
        double expectedMinutes = entry.getPlannedOutput() * (double) step.timePerPiece() / 60.0;
        return OptionalDouble.of(expectedMinutes / actualMinutes * 100);
    }

    /**
     * @param samples 新しい順の効率値。先頭 windowSize 件のみ使う
     */
    public Optional<ProficiencyAdjustment> evaluate(Long workerId, Long stepId, int currentLevel, List<Double> samples) {
        List<Double> window = samples.size() > windowSize ? samples.subList(0, windowSize) : samples;
        if (window.size() < minSamples) {
            return Optional.empty();
        }
        double avg = window.stream().mapToDouble(Double::doubleValue).average().orElse(0);
        if (avg > highThreshold && currentLevel < Proficiency.MAX_LEVEL) {
            return Optional.of(new ProficiencyAdjustment(workerId, stepId, currentLevel, currentLevel + 1,
                    ProficiencyChangeReason.AUTO_INCREASE, round1(avg), window.size()));
        }
        if (avg < lowThreshold && currentLevel > Proficiency.MIN_LEVEL) {
            return Optional.of(new ProficiencyAdjustment(workerId, stepId, currentLevel, currentLevel - 1,
                    ProficiencyChangeReason.AUTO_DECREASE, round1(avg), window.size()));
        }
        return Optional.empty();
    }

    private static double round1(double v) {
        return Math.round(v * 10) / 10.0;
    }
}
