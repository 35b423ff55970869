package com.flagship.bounty_ledger.outbox;

import java.time.Instant;
import java.util.UUID;

/**
 * Common shape of every lifecycle event written to the outbox.
 *
 * Events are facts: they are written in the same transaction as the state change they
 * describe and are never updated afterwards.
 */
public interface BountyEvent {

    /**
     * Unique identifier for this event instance, used by consumers for deduplication.
     */
    UUID getEventId();

    /**
     * The Task, Submission or Payment the event is about.
     */
    UUID getAggregateId();

    String getAggregateType();

    Instant getOccurredAt();

    String getEventType();
}
