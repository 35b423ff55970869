package com.flagship.bounty_ledger.submission;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * PENDING moves exactly once, to APPROVED or REJECTED. Both are terminal.
 */
public enum SubmissionStatus {
    @JsonProperty("pending")
    PENDING,
    @JsonProperty("approved")
    APPROVED,
    @JsonProperty("rejected")
    REJECTED;

    public boolean canTransitionTo(SubmissionStatus target) {
        return this == PENDING && (target == APPROVED || target == REJECTED);
    }
}
