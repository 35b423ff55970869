package com.flagship.bounty_ledger.task.event;

import com.flagship.bounty_ledger.outbox.BountyEvent;
import com.flagship.bounty_ledger.task.Task;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A task was published and is open for claims.
 */
@Value
public class TaskCreatedEvent implements BountyEvent {
    public static final String EVENT_TYPE = "TaskCreated";
    public static final String AGGREGATE_TYPE = "Task";

    UUID eventId;
    UUID taskId;
    String title;
    String taskType;
    BigDecimal reward;
    int maxSubmissions;
    Instant deadline;
    Instant occurredAt;

    public static TaskCreatedEvent fromTask(Task task) {
        return new TaskCreatedEvent(
            UUID.randomUUID(),
            task.getId(),
            task.getTitle(),
            task.getTaskType().name(),
            task.getReward(),
            task.getMaxSubmissions(),
            task.getDeadline(),
            Instant.now()
        );
    }

    @Override
    public UUID getAggregateId() {
        return taskId;
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
