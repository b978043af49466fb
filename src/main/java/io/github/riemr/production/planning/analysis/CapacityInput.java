package io.github.riemr.production.planning.analysis;

import io.github.riemr.production.domain.model.Order;
import io.github.riemr.production.domain.model.ProductStep;
import io.github.riemr.production.domain.model.ScheduleEntry;
import io.github.riemr.production.planning.catalog.ResourceSnapshot;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * 分析の入力一式。同じ入力からは常に同じ結果になる。
 */
@Value
@Builder(toBuilder = true)
public class CapacityInput {
    LocalDateTime now;
    List<Order> openOrders;
    Map<Long, List<ProductStep>> stepsByProduct;
    Map<Long, List<ScheduleEntry>> entriesByOrder;
    ResourceSnapshot snapshot;
    /** 直近の全体効率（1.0 = 標準）。 */
    @Builder.Default
    double efficiencyFactor = 1.0;
    /** 作業者ごとの 1 日の稼働時間の上書き。指定のない作業者は定時。 */
    @Builder.Default
    Map<Long, Double> hoursPerDayByWorker = Map.of();
}
