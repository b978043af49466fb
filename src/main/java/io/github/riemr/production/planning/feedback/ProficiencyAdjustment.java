package io.github.riemr.production.planning.feedback;

import io.github.riemr.production.domain.model.ProficiencyChangeReason;
import lombok.Value;

/** 実績効率から導いた習熟度変更案。 */
@Value
public class ProficiencyAdjustment {
    Long workerId;
    Long stepId;
    int currentLevel;
    int newLevel;
    ProficiencyChangeReason reason;
    double avgEfficiency;
    int sampleSize;
}
