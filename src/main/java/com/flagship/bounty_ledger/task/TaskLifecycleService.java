package com.flagship.bounty_ledger.task;

import com.flagship.bounty_ledger.config.BountyProperties;
import com.flagship.bounty_ledger.exception.LimitExceededException;
import com.flagship.bounty_ledger.observability.OrchestrationMetrics;
import com.flagship.bounty_ledger.outbox.OutboxService;
import com.flagship.bounty_ledger.task.event.TaskCreatedEvent;
import com.flagship.bounty_ledger.user.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Owns Task state transitions.
 *
 * <ul>
 *   <li>create - OPEN, counter 0; reward above the configured maximum is refused here</li>
 *   <li>claim - OPEN to IN_PROGRESS, bound to one worker</li>
 *   <li>registerSubmission / releaseSubmissionSlot - counter moves, status follows the cap</li>
 *   <li>completeOnApproval / cancel - terminal</li>
 * </ul>
 *
 * The counter-moving operations run inside the submission flows' transactions under the task's
 * row lock, so a cap check and its increment never interleave with another writer.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TaskLifecycleService {

    static final int MAX_REWARD_SCALE = 9;

    private final TaskPersistenceService persistenceService;
    private final UserService userService;
    private final OutboxService outboxService;
    private final OrchestrationMetrics metrics;
    private final BountyProperties properties;

    @Transactional
    public Task create(String title, String description, TaskType taskType, BigDecimal reward,
                       String verificationCriteria, Integer maxSubmissions, Instant deadline) {
        requireText(title, "Title");
        requireText(description, "Description");
        requireText(verificationCriteria, "Verification criteria");
        if (taskType == null) {
            throw new IllegalArgumentException("Task type is required");
        }
        validateReward(reward);
        int cap = maxSubmissions == null ? 1 : maxSubmissions;
        if (cap < 1) {
            throw new IllegalArgumentException("Max submissions must be at least 1");
        }
        if (deadline != null && !deadline.isAfter(Instant.now())) {
            throw new IllegalArgumentException("Deadline must be in the future");
        }

        Task task = persistenceService.save(Task.create(UUID.randomUUID(), title.trim(), description.trim(),
                taskType, reward, verificationCriteria.trim(), cap, deadline));
        outboxService.saveEvent(TaskCreatedEvent.fromTask(task));
        metrics.recordTaskCreated();

        log.info("Task created: id={}, reward={}, cap={}", task.getId(), reward.toPlainString(), cap);
        return task;
    }

    @Transactional
    public Task claim(UUID taskId, UUID workerId) {
        userService.getUser(workerId);
        Task claimed = persistenceService.getForUpdate(taskId).claim(workerId, Instant.now());
        Task saved = persistenceService.update(claimed);
        log.info("Task {} claimed by worker {}", taskId, workerId);
        return saved;
    }

    @Transactional
    public Task cancel(UUID taskId) {
        Task cancelled = persistenceService.update(persistenceService.getForUpdate(taskId).cancel());
        log.info("Task {} cancelled", taskId);
        return cancelled;
    }

    /**
     * Counts one accepted submission. The caller holds the task lock and has already checked
     * {@link Task#hasCapacity()}.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Task registerSubmission(UUID taskId) {
        Task task = persistenceService.update(persistenceService.getForUpdate(taskId).registerSubmission());
        if (task.getStatus() == TaskStatus.PENDING_VERIFICATION) {
            log.info("Task {} reached its submission cap of {}", taskId, task.getMaxSubmissions());
        }
        return task;
    }

    /**
     * Gives a rejected submission's slot back to the task.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Task releaseSubmissionSlot(UUID taskId) {
        Task task = persistenceService.getForUpdate(taskId);
        Task released = task.releaseSubmissionSlot();
        return released == task ? task : persistenceService.update(released);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public Task completeOnApproval(UUID taskId) {
        Task task = persistenceService.getForUpdate(taskId);
        Task completed = task.completeOnApproval();
        if (completed == task) {
            return task;
        }
        log.info("Task {} completed", taskId);
        return persistenceService.update(completed);
    }

    public Task getTask(UUID taskId) {
        return persistenceService.get(taskId);
    }

    public List<Task> listTasks() {
        return persistenceService.findAllNewestFirst();
    }

    public List<Task> listOpenTasks() {
        return persistenceService.findByStatus(TaskStatus.OPEN);
    }

    void validateReward(BigDecimal reward) {
        if (reward == null || reward.signum() <= 0) {
            throw new IllegalArgumentException("Reward must be greater than 0");
        }
        if (reward.stripTrailingZeros().scale() > MAX_REWARD_SCALE) {
            throw new IllegalArgumentException("Reward supports at most " + MAX_REWARD_SCALE + " decimal places");
        }
        BigDecimal maxReward = properties.getLimits().getMaxReward();
        if (reward.compareTo(maxReward) > 0) {
            throw new LimitExceededException(
                    "Reward " + reward.toPlainString() + " exceeds maximum of " + maxReward.toPlainString(), maxReward);
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
    }
}
