package com.flagship.bounty_ledger.task;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for Task persistence.
 *
 * No setters: state only changes through {@link #updateFromDomain(Task)}, which copies the
 * mutable fields of a validated domain transition. Reward, criteria and cap are fixed at creation.
 * The version column gives each record a single writer at a time.
 */
@Entity
@Table(name = "tasks")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TaskEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, updatable = false, length = 200)
    private String title;

    @Column(nullable = false, updatable = false)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "task_type", nullable = false, updatable = false, length = 20)
    private TaskType taskType;

    @Column(nullable = false, updatable = false, precision = 18, scale = 9)
    private BigDecimal reward;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private TaskStatus status;

    @Column(name = "verification_criteria", nullable = false, updatable = false)
    private String verificationCriteria;

    @Column(name = "max_submissions", nullable = false, updatable = false)
    private int maxSubmissions;

    @Column(name = "current_submissions", nullable = false)
    private int currentSubmissions;

    @Column(updatable = false)
    private Instant deadline;

    @Column(name = "assigned_to")
    private UUID assignedTo;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private long version;

    static TaskEntity fromDomain(Task task) {
        return new TaskEntity(
            task.getId(),
            task.getTitle(),
            task.getDescription(),
            task.getTaskType(),
            task.getReward(),
            task.getStatus(),
            task.getVerificationCriteria(),
            task.getMaxSubmissions(),
            task.getCurrentSubmissions(),
            task.getDeadline(),
            task.getAssignedTo(),
            task.getCreatedAt(),
            task.getUpdatedAt(),
            0L
        );
    }

    public Task toDomain() {
        return new Task(
            id,
            title,
            description,
            taskType,
            reward,
            status,
            verificationCriteria,
            maxSubmissions,
            currentSubmissions,
            deadline,
            assignedTo,
            createdAt,
            updatedAt
        );
    }

    /**
     * Copies status, counter, assignee and timestamp from a validated transition.
     */
    void updateFromDomain(Task task) {
        if (!task.getId().equals(this.id)) {
            throw new IllegalArgumentException("Task id mismatch: " + task.getId() + " vs " + this.id);
        }
        this.status = task.getStatus();
        this.currentSubmissions = task.getCurrentSubmissions();
        this.assignedTo = task.getAssignedTo();
        this.updatedAt = task.getUpdatedAt();
    }
}
