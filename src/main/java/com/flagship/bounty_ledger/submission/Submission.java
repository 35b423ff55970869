package com.flagship.bounty_ledger.submission;

import com.flagship.bounty_ledger.collaborator.JudgeVerdict;
import com.flagship.bounty_ledger.exception.ConflictException;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A worker's proof against a task.
 *
 * Immutable. The verdict is applied once: the verification timestamp is stamped with it and
 * never changes afterwards.
 */
@Value
public class Submission {
    UUID id;
    UUID taskId;
    UUID workerId;
    ProofType proofType;
    String proofData;
    String proofDescription;
    SubmissionStatus status;
    String verdictReasoning;
    Integer verdictScore;
    Instant submittedAt;
    Instant verifiedAt;

    public static Submission create(UUID taskId, UUID workerId, ProofType proofType,
                                    String proofData, String proofDescription) {
        return new Submission(UUID.randomUUID(), taskId, workerId, proofType, proofData, proofDescription,
                SubmissionStatus.PENDING, null, null, Instant.now(), null);
    }

    /**
     * Applies a judge verdict: APPROVED or REJECTED with reasoning and clamped score.
     *
     * @throws ConflictException if the submission has already been decided
     */
    public Submission decide(JudgeVerdict verdict) {
        SubmissionStatus target = verdict.isApproved() ? SubmissionStatus.APPROVED : SubmissionStatus.REJECTED;
        if (!status.canTransitionTo(target)) {
            throw new ConflictException("Submission " + id + " has already been " + status.name().toLowerCase());
        }
        return new Submission(id, taskId, workerId, proofType, proofData, proofDescription, target,
                verdict.getReasoning(), JudgeVerdict.clampScore(verdict.getScore()), submittedAt, Instant.now());
    }

    public boolean isPending() {
        return status == SubmissionStatus.PENDING;
    }

    public boolean isApproved() {
        return status == SubmissionStatus.APPROVED;
    }
}
