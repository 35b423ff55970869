package com.flagship.bounty_ledger.task;

import com.flagship.bounty_ledger.exception.ConflictException;
import lombok.Value;
import lombok.With;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Task domain object: a unit of requested work with a fixed reward.
 *
 * Immutable; every transition returns a new instance and is validated against
 * {@link TaskStatus#canTransitionTo}. Invariant: {@code 0 <= currentSubmissions <= maxSubmissions},
 * and reaching the cap moves the task out of OPEN/IN_PROGRESS.
 */
@Value
@With
public class Task {
    UUID id;
    String title;
    String description;
    TaskType taskType;
    BigDecimal reward;
    TaskStatus status;
    String verificationCriteria;
    int maxSubmissions;
    int currentSubmissions;
    Instant deadline;
    UUID assignedTo;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a new Task in OPEN status with no submissions.
     */
    public static Task create(UUID id, String title, String description, TaskType taskType,
                              BigDecimal reward, String verificationCriteria,
                              int maxSubmissions, Instant deadline) {
        Instant now = Instant.now();
        return new Task(id, title, description, taskType, reward, TaskStatus.OPEN,
                verificationCriteria, maxSubmissions, 0, deadline, null, now, now);
    }

    /**
     * Binds the task to one worker. Only OPEN tasks can be claimed.
     */
    public Task claim(UUID workerId, Instant now) {
        if (status != TaskStatus.OPEN) {
            throw new ConflictException(
                String.format("Task %s is %s; only open tasks can be claimed", id, status));
        }
        if (isPastDeadline(now)) {
            throw new ConflictException("Task " + id + " deadline has passed");
        }
        return transitionTo(TaskStatus.IN_PROGRESS).withAssignedTo(workerId);
    }

    /**
     * Counts one more submission. Reaching the cap moves the task to PENDING_VERIFICATION.
     * Callers pre-check {@link #hasCapacity()} before creating the Submission.
     */
    public Task registerSubmission() {
        if (status.isTerminal()) {
            throw new ConflictException("Task " + id + " is closed");
        }
        if (!hasCapacity()) {
            throw new ConflictException("Maximum submissions reached for task " + id);
        }
        Task counted = withCurrentSubmissions(currentSubmissions + 1).withUpdatedAt(Instant.now());
        if (counted.hasReachedCap() && status != TaskStatus.PENDING_VERIFICATION) {
            return counted.transitionTo(TaskStatus.PENDING_VERIFICATION);
        }
        return counted;
    }

    /**
     * Gives back the slot held by a rejected submission so another attempt can be made.
     * Terminal tasks are left untouched.
     */
    public Task releaseSubmissionSlot() {
        if (status.isTerminal() || currentSubmissions == 0) {
            return this;
        }
        Task released = withCurrentSubmissions(currentSubmissions - 1).withUpdatedAt(Instant.now());
        if (status == TaskStatus.PENDING_VERIFICATION) {
            return released.transitionTo(assignedTo != null ? TaskStatus.IN_PROGRESS : TaskStatus.OPEN);
        }
        return released;
    }

    /**
     * Approval path: the task completes once its submission cap has been reached.
     * Below the cap the task keeps accepting work; an already completed task is left as is.
     */
    public Task completeOnApproval() {
        if (status == TaskStatus.COMPLETED || !hasReachedCap()) {
            return this;
        }
        return transitionTo(TaskStatus.COMPLETED);
    }

    public Task cancel() {
        return transitionTo(TaskStatus.CANCELLED);
    }

    public boolean hasCapacity() {
        return currentSubmissions < maxSubmissions;
    }

    public boolean hasReachedCap() {
        return currentSubmissions >= maxSubmissions;
    }

    public boolean isPastDeadline(Instant now) {
        return deadline != null && now.isAfter(deadline);
    }

    public boolean isAssignedTo(UUID workerId) {
        return assignedTo != null && assignedTo.equals(workerId);
    }

    private Task transitionTo(TaskStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new ConflictException(
                String.format("Cannot move task %s from %s to %s", id, status, target));
        }
        return withStatus(target).withUpdatedAt(Instant.now());
    }
}
