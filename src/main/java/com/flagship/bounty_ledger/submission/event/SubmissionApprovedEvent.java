package com.flagship.bounty_ledger.submission.event;

import com.flagship.bounty_ledger.outbox.BountyEvent;
import com.flagship.bounty_ledger.submission.Submission;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * The judge approved a submission. Payment creation, if any, is a separate PaymentCreated event.
 */
@Value
public class SubmissionApprovedEvent implements BountyEvent {
    public static final String EVENT_TYPE = "SubmissionApproved";
    public static final String AGGREGATE_TYPE = "Submission";

    UUID eventId;
    UUID submissionId;
    UUID taskId;
    UUID workerId;
    Integer score;
    String reasoning;
    Instant occurredAt;

    public static SubmissionApprovedEvent fromSubmission(Submission submission) {
        return new SubmissionApprovedEvent(
            UUID.randomUUID(),
            submission.getId(),
            submission.getTaskId(),
            submission.getWorkerId(),
            submission.getVerdictScore(),
            submission.getVerdictReasoning(),
            submission.getVerifiedAt()
        );
    }

    @Override
    public UUID getAggregateId() {
        return submissionId;
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
