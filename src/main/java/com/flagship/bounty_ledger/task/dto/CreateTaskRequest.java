package com.flagship.bounty_ledger.task.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bounty_ledger.task.TaskType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
@Jacksonized
public class CreateTaskRequest {

    @NotBlank(message = "Title is required")
    @Size(max = 200, message = "Title must be at most 200 characters")
    @JsonProperty("title")
    String title;

    @NotBlank(message = "Description is required")
    @JsonProperty("description")
    String description;

    @NotNull(message = "Task type is required")
    @JsonProperty("task_type")
    TaskType taskType;

    @NotNull(message = "Reward is required")
    @DecimalMin(value = "0", inclusive = false, message = "Reward must be greater than 0")
    @JsonProperty("reward")
    BigDecimal reward;

    @NotBlank(message = "Verification criteria is required")
    @JsonProperty("verification_criteria")
    String verificationCriteria;

    @Min(value = 1, message = "Max submissions must be at least 1")
    @JsonProperty("max_submissions")
    Integer maxSubmissions;

    @JsonProperty("deadline")
    Instant deadline;
}
