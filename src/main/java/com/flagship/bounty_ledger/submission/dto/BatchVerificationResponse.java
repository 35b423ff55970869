package com.flagship.bounty_ledger.submission.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bounty_ledger.submission.VerificationOutcome;
import com.flagship.bounty_ledger.submission.VerificationResult;
import lombok.Value;

import java.util.List;

@Value
public class BatchVerificationResponse {

    @JsonProperty("processed")
    int processed;

    @JsonProperty("approved")
    long approved;

    @JsonProperty("rejected")
    long rejected;

    @JsonProperty("errors")
    long errors;

    @JsonProperty("results")
    List<VerificationResponse> results;

    public static BatchVerificationResponse from(List<VerificationResult> results) {
        return new BatchVerificationResponse(
                results.size(),
                results.stream().filter(VerificationResult::isApproved).count(),
                results.stream().filter(r -> r.getOutcome() == VerificationOutcome.REJECTED).count(),
                results.stream().filter(r -> r.getOutcome() == VerificationOutcome.ERROR).count(),
                results.stream().map(VerificationResponse::from).toList());
    }
}
