package io.github.riemr.production.application.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class ProficiencyUpdateRequest {
    @NotNull
    @Min(1)
    @Max(5)
    private Integer level;
}
