package com.flagship.bounty_ledger.submission;

import com.flagship.bounty_ledger.collaborator.JudgeVerdict;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
@Builder
public class VerificationResult {
    UUID submissionId;
    VerificationOutcome outcome;
    Integer score;
    String reasoning;
    List<String> suggestions;
    UUID paymentId;
    String error;

    static VerificationResult decided(UUID submissionId, VerificationOutcome outcome, JudgeVerdict verdict,
                                      UUID paymentId) {
        return VerificationResult.builder()
                .submissionId(submissionId)
                .outcome(outcome)
                .score(verdict.getScore())
                .reasoning(verdict.getReasoning())
                .suggestions(verdict.getSuggestions())
                .paymentId(paymentId)
                .build();
    }

    static VerificationResult error(UUID submissionId, String error) {
        return VerificationResult.builder()
                .submissionId(submissionId)
                .outcome(VerificationOutcome.ERROR)
                .error(error)
                .build();
    }

    public boolean isApproved() {
        return outcome == VerificationOutcome.APPROVED || outcome == VerificationOutcome.APPROVED_UNPAID;
    }
}
