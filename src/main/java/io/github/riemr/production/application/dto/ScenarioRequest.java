package io.github.riemr.production.application.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class ScenarioRequest {
    @NotBlank
    private String name;

    private String description;

    @Valid
    private List<WorkerPoolOverride> workerPool = new ArrayList<>();

    @Min(1)
    private int weeks = 8;
}
