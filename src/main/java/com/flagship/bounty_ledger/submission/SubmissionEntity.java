package com.flagship.bounty_ledger.submission;

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

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for submissions. Proof fields are write-once; only the verdict columns change,
 * and only through {@link #updateFromDomain(Submission)}.
 */
@Entity
@Table(name = "submissions")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SubmissionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "task_id", nullable = false, updatable = false)
    private UUID taskId;

    @Column(name = "worker_id", nullable = false, updatable = false)
    private UUID workerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "proof_type", nullable = false, updatable = false, length = 10)
    private ProofType proofType;

    @Column(name = "proof_data", nullable = false, updatable = false)
    private String proofData;

    @Column(name = "proof_description", updatable = false)
    private String proofDescription;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SubmissionStatus status;

    @Column(name = "verdict_reasoning")
    private String verdictReasoning;

    @Column(name = "verdict_score")
    private Integer verdictScore;

    @Column(name = "submitted_at", nullable = false, updatable = false)
    private Instant submittedAt;

    @Column(name = "verified_at")
    private Instant verifiedAt;

    @Version
    private long version;

    static SubmissionEntity fromDomain(Submission submission) {
        return new SubmissionEntity(
            submission.getId(),
            submission.getTaskId(),
            submission.getWorkerId(),
            submission.getProofType(),
            submission.getProofData(),
            submission.getProofDescription(),
            submission.getStatus(),
            submission.getVerdictReasoning(),
            submission.getVerdictScore(),
            submission.getSubmittedAt(),
            submission.getVerifiedAt(),
            0L
        );
    }

    public Submission toDomain() {
        return new Submission(id, taskId, workerId, proofType, proofData, proofDescription, status,
                verdictReasoning, verdictScore, submittedAt, verifiedAt);
    }

    void updateFromDomain(Submission submission) {
        if (!submission.getId().equals(this.id)) {
            throw new IllegalArgumentException("Submission id mismatch: " + submission.getId() + " vs " + this.id);
        }
        if (this.verifiedAt != null) {
            throw new IllegalStateException("Submission " + id + " verdict is already recorded");
        }
        this.status = submission.getStatus();
        this.verdictReasoning = submission.getVerdictReasoning();
        this.verdictScore = submission.getVerdictScore();
        this.verifiedAt = submission.getVerifiedAt();
    }
}
