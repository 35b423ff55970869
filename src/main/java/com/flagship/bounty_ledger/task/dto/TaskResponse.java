package com.flagship.bounty_ledger.task.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bounty_ledger.task.Task;
import com.flagship.bounty_ledger.task.TaskStatus;
import com.flagship.bounty_ledger.task.TaskType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class TaskResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("title")
    String title;

    @JsonProperty("description")
    String description;

    @JsonProperty("task_type")
    TaskType taskType;

    @JsonProperty("reward")
    BigDecimal reward;

    @JsonProperty("status")
    TaskStatus status;

    @JsonProperty("verification_criteria")
    String verificationCriteria;

    @JsonProperty("max_submissions")
    int maxSubmissions;

    @JsonProperty("current_submissions")
    int currentSubmissions;

    @JsonProperty("deadline")
    Instant deadline;

    @JsonProperty("assigned_to")
    UUID assignedTo;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static TaskResponse from(Task task) {
        return TaskResponse.builder()
            .id(task.getId())
            .title(task.getTitle())
            .description(task.getDescription())
            .taskType(task.getTaskType())
            .reward(task.getReward())
            .status(task.getStatus())
            .verificationCriteria(task.getVerificationCriteria())
            .maxSubmissions(task.getMaxSubmissions())
            .currentSubmissions(task.getCurrentSubmissions())
            .deadline(task.getDeadline())
            .assignedTo(task.getAssignedTo())
            .createdAt(task.getCreatedAt())
            .updatedAt(task.getUpdatedAt())
            .build();
    }
}
