package com.flagship.bounty_ledger.task;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.EnumSet;
import java.util.Set;

/**
 * Task lifecycle status with its transition table.
 *
 * <pre>
 * OPEN                 → IN_PROGRESS, PENDING_VERIFICATION, COMPLETED, CANCELLED
 * IN_PROGRESS          → PENDING_VERIFICATION, COMPLETED, CANCELLED
 * PENDING_VERIFICATION → COMPLETED, CANCELLED, IN_PROGRESS, OPEN
 * COMPLETED, CANCELLED → (terminal)
 * </pre>
 *
 * PENDING_VERIFICATION falls back to IN_PROGRESS or OPEN only when a rejection
 * releases a submission slot.
 */
public enum TaskStatus {

    @JsonProperty("open")
    OPEN,

    @JsonProperty("in_progress")
    IN_PROGRESS,

    @JsonProperty("pending_verification")
    PENDING_VERIFICATION,

    @JsonProperty("completed")
    COMPLETED,

    @JsonProperty("cancelled")
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    public boolean canTransitionTo(TaskStatus target) {
        return allowedTargets().contains(target);
    }

    private Set<TaskStatus> allowedTargets() {
        return switch (this) {
            case OPEN -> EnumSet.of(IN_PROGRESS, PENDING_VERIFICATION, COMPLETED, CANCELLED);
            case IN_PROGRESS -> EnumSet.of(PENDING_VERIFICATION, COMPLETED, CANCELLED);
            case PENDING_VERIFICATION -> EnumSet.of(COMPLETED, CANCELLED, IN_PROGRESS, OPEN);
            case COMPLETED, CANCELLED -> EnumSet.noneOf(TaskStatus.class);
        };
    }
}
