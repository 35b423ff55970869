package com.flagship.bounty_ledger.task.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bounty_ledger.task.Task;
import lombok.Value;

import java.util.List;

@Value
public class GenerateTasksResponse {

    @JsonProperty("created")
    int created;

    @JsonProperty("tasks")
    List<TaskResponse> tasks;

    public static GenerateTasksResponse from(List<Task> tasks) {
        return new GenerateTasksResponse(tasks.size(), tasks.stream().map(TaskResponse::from).toList());
    }
}
