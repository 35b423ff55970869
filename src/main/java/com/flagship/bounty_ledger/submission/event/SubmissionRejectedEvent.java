package com.flagship.bounty_ledger.submission.event;

import com.flagship.bounty_ledger.outbox.BountyEvent;
import com.flagship.bounty_ledger.submission.Submission;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class SubmissionRejectedEvent implements BountyEvent {
    public static final String EVENT_TYPE = "SubmissionRejected";
    public static final String AGGREGATE_TYPE = "Submission";

    UUID eventId;
    UUID submissionId;
    UUID taskId;
    UUID workerId;
    Integer score;
    String reasoning;
    Instant occurredAt;

    public static SubmissionRejectedEvent fromSubmission(Submission submission) {
        return new SubmissionRejectedEvent(
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
