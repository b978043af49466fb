package io.github.riemr.production.application.dto;

import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.Set;

@Data
public class ReplanRequest {
    private LocalDate newStartDate;

    private Set<Long> excludedWorkerIds = new HashSet<>();

    @Positive
    private Long timeoutSeconds;
}
