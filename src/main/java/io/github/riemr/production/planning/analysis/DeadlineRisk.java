package io.github.riemr.production.planning.analysis;

import io.github.riemr.production.domain.model.OrderStatus;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

@Value
@Builder
public class DeadlineRisk {
    Long orderId;
    String productName;
    int quantity;
    LocalDate dueDate;
    OrderStatus status;
    long daysToDue;
    double requiredHours;
    double availableHours;
    double shortfallHours;
    boolean canMeet;
    List<SkillGroupRisk> groups;
}
