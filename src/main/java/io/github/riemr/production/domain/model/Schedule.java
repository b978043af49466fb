package io.github.riemr.production.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Schedule {
    private Long id;
    private Long orderId;
    private LocalDate startDate;
    private LocalDateTime createdAt;
    @Builder.Default
    private List<ScheduleEntry> entries = new ArrayList<>();
}
