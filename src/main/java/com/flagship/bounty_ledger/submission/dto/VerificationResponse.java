package com.flagship.bounty_ledger.submission.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bounty_ledger.submission.VerificationOutcome;
import com.flagship.bounty_ledger.submission.VerificationResult;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
@Builder
public class VerificationResponse {

    @JsonProperty("submission_id")
    UUID submissionId;

    @JsonProperty("outcome")
    VerificationOutcome outcome;

    @JsonProperty("score")
    Integer score;

    @JsonProperty("reasoning")
    String reasoning;

    @JsonProperty("suggestions")
    List<String> suggestions;

    @JsonProperty("payment_id")
    UUID paymentId;

    @JsonProperty("error")
    String error;

    public static VerificationResponse from(VerificationResult result) {
        return VerificationResponse.builder()
            .submissionId(result.getSubmissionId())
            .outcome(result.getOutcome())
            .score(result.getScore())
            .reasoning(result.getReasoning())
            .suggestions(result.getSuggestions())
            .paymentId(result.getPaymentId())
            .error(result.getError())
            .build();
    }
}
