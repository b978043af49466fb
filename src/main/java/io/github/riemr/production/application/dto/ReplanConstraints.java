package io.github.riemr.production.application.dto;

import java.time.Duration;
import java.util.Set;

/**
 * 再計画時の追加制約。
 *
 * @param excludedWorkerIds 割当から外す作業者（休暇・急な欠勤など）
 * @param timeout null なら既定のタイムアウト
 */
public record ReplanConstraints(
    Set<Long> excludedWorkerIds,
    Duration timeout
) {
    public static ReplanConstraints none() {
        return new ReplanConstraints(Set.of(), null);
    }
}
