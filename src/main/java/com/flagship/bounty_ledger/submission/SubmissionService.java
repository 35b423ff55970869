package com.flagship.bounty_ledger.submission;

import com.flagship.bounty_ledger.exception.ConflictException;
import com.flagship.bounty_ledger.observability.OrchestrationMetrics;
import com.flagship.bounty_ledger.task.Task;
import com.flagship.bounty_ledger.task.TaskLifecycleService;
import com.flagship.bounty_ledger.task.TaskPersistenceService;
import com.flagship.bounty_ledger.user.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Submission intake and lookups.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubmissionService {

    private final SubmissionPersistenceService persistenceService;
    private final TaskPersistenceService taskPersistenceService;
    private final TaskLifecycleService taskLifecycleService;
    private final UserService userService;
    private final OrchestrationMetrics metrics;

    /**
     * Accepts a proof against a task.
     *
     * Runs under the task's row lock: the cap pre-check, the new submission and the counter
     * increment commit together, so two concurrent submissions can never both take the last slot.
     */
    @Transactional
    public Submission submit(UUID taskId, UUID workerId, ProofType proofType,
                             String proofData, String proofDescription) {
        if (proofType == null) {
            throw new IllegalArgumentException("Proof type is required");
        }
        if (proofData == null || proofData.isBlank()) {
            throw new IllegalArgumentException("Proof data is required");
        }
        userService.getUser(workerId);

        Task task = taskPersistenceService.getForUpdate(taskId);
        if (task.getStatus().isTerminal()) {
            throw new ConflictException("Task " + taskId + " is " + task.getStatus().name().toLowerCase()
                    + " and no longer accepts submissions");
        }
        if (task.isPastDeadline(Instant.now())) {
            throw new ConflictException("Task " + taskId + " deadline has passed");
        }
        if (task.getAssignedTo() != null && !task.isAssignedTo(workerId)) {
            throw new ConflictException("Task " + taskId + " is assigned to another worker");
        }
        if (!task.hasCapacity()) {
            throw new ConflictException("Maximum submissions reached for task " + taskId);
        }

        Submission submission = persistenceService.save(
                Submission.create(taskId, workerId, proofType, proofData, blankToNull(proofDescription)));
        taskLifecycleService.registerSubmission(taskId);
        metrics.recordSubmissionReceived(proofType.label());

        log.info("Submission {} received for task {} from worker {}", submission.getId(), taskId, workerId);
        return submission;
    }

    public Submission getSubmission(UUID submissionId) {
        return persistenceService.get(submissionId);
    }

    public List<Submission> listPending() {
        return persistenceService.findPending();
    }

    public List<Submission> listForTask(UUID taskId) {
        taskPersistenceService.get(taskId);
        return persistenceService.findByTask(taskId);
    }

    public List<Submission> listForWorker(UUID workerId) {
        userService.getUser(workerId);
        return persistenceService.findByWorker(workerId);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
