package com.flagship.bounty_ledger.task;

import com.flagship.bounty_ledger.submission.SubmissionService;
import com.flagship.bounty_ledger.submission.dto.SubmissionResponse;
import com.flagship.bounty_ledger.task.dto.ClaimTaskRequest;
import com.flagship.bounty_ledger.task.dto.CreateTaskRequest;
import com.flagship.bounty_ledger.task.dto.GenerateTasksRequest;
import com.flagship.bounty_ledger.task.dto.GenerateTasksResponse;
import com.flagship.bounty_ledger.task.dto.TaskResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Task board. Listing and claiming are open to workers; create, generate and cancel are admin-only.
 */
@RestController
@RequestMapping("/api/tasks")
@RequiredArgsConstructor
public class TaskController {

    private final TaskLifecycleService lifecycleService;
    private final TaskGenerationService generationService;
    private final SubmissionService submissionService;

    @GetMapping
    public List<TaskResponse> listTasks() {
        return lifecycleService.listTasks().stream().map(TaskResponse::from).toList();
    }

    @GetMapping("/open")
    public List<TaskResponse> listOpenTasks() {
        return lifecycleService.listOpenTasks().stream().map(TaskResponse::from).toList();
    }

    @GetMapping("/{id}")
    public TaskResponse getTask(@PathVariable("id") UUID id) {
        return TaskResponse.from(lifecycleService.getTask(id));
    }

    @GetMapping("/{id}/submissions")
    public List<SubmissionResponse> listSubmissions(@PathVariable("id") UUID id) {
        return submissionService.listForTask(id).stream().map(SubmissionResponse::from).toList();
    }

    @PostMapping
    public ResponseEntity<TaskResponse> createTask(@Valid @RequestBody CreateTaskRequest request) {
        Task task = lifecycleService.create(request.getTitle(), request.getDescription(), request.getTaskType(),
                request.getReward(), request.getVerificationCriteria(), request.getMaxSubmissions(),
                request.getDeadline());
        return ResponseEntity.status(HttpStatus.CREATED).body(TaskResponse.from(task));
    }

    @PostMapping("/generate")
    public ResponseEntity<GenerateTasksResponse> generateTasks(@Valid @RequestBody GenerateTasksRequest request) {
        List<Task> tasks = generationService.generate(request.getProjectContext(), request.getBudget(),
                request.getCount());
        return ResponseEntity.status(HttpStatus.CREATED).body(GenerateTasksResponse.from(tasks));
    }

    @PostMapping("/{id}/claim")
    public TaskResponse claimTask(@PathVariable("id") UUID id, @Valid @RequestBody ClaimTaskRequest request) {
        return TaskResponse.from(lifecycleService.claim(id, request.getWorkerId()));
    }

    @PostMapping("/{id}/cancel")
    public TaskResponse cancelTask(@PathVariable("id") UUID id) {
        return TaskResponse.from(lifecycleService.cancel(id));
    }
}
