package com.flagship.bounty_ledger.submission.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bounty_ledger.submission.ProofType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.UUID;

@Value
@Builder
@Jacksonized
public class CreateSubmissionRequest {

    @NotNull(message = "Task ID is required")
    @JsonProperty("task_id")
    UUID taskId;

    @NotNull(message = "Worker ID is required")
    @JsonProperty("worker_id")
    UUID workerId;

    @NotNull(message = "Proof type is required")
    @JsonProperty("proof_type")
    ProofType proofType;

    @NotBlank(message = "Proof data is required")
    @JsonProperty("proof_data")
    String proofData;

    @Size(max = 2000, message = "Proof description must be at most 2000 characters")
    @JsonProperty("proof_description")
    String proofDescription;
}
