package com.flagship.bounty_ledger.submission.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bounty_ledger.submission.ProofType;
import com.flagship.bounty_ledger.submission.Submission;
import com.flagship.bounty_ledger.submission.SubmissionStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class SubmissionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("task_id")
    UUID taskId;

    @JsonProperty("worker_id")
    UUID workerId;

    @JsonProperty("proof_type")
    ProofType proofType;

    @JsonProperty("proof_data")
    String proofData;

    @JsonProperty("proof_description")
    String proofDescription;

    @JsonProperty("status")
    SubmissionStatus status;

    @JsonProperty("verdict_reasoning")
    String verdictReasoning;

    @JsonProperty("verdict_score")
    Integer verdictScore;

    @JsonProperty("submitted_at")
    Instant submittedAt;

    @JsonProperty("verified_at")
    Instant verifiedAt;

    public static SubmissionResponse from(Submission submission) {
        return SubmissionResponse.builder()
            .id(submission.getId())
            .taskId(submission.getTaskId())
            .workerId(submission.getWorkerId())
            .proofType(submission.getProofType())
            .proofData(submission.getProofData())
            .proofDescription(submission.getProofDescription())
            .status(submission.getStatus())
            .verdictReasoning(submission.getVerdictReasoning())
            .verdictScore(submission.getVerdictScore())
            .submittedAt(submission.getSubmittedAt())
            .verifiedAt(submission.getVerifiedAt())
            .build();
    }
}
