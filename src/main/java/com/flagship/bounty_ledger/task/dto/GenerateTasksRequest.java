package com.flagship.bounty_ledger.task.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder
@Jacksonized
public class GenerateTasksRequest {

    @NotBlank(message = "Project context is required")
    @JsonProperty("project_context")
    String projectContext;

    @NotNull(message = "Budget is required")
    @DecimalMin(value = "0", inclusive = false, message = "Budget must be greater than 0")
    @JsonProperty("budget")
    BigDecimal budget;

    @Min(value = 1, message = "Count must be between 1 and 20")
    @Max(value = 20, message = "Count must be between 1 and 20")
    @JsonProperty("count")
    Integer count;
}
