package com.flagship.bounty_ledger.submission;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * What one verification attempt did.
 *
 * ERROR means the judge could not be reached or answered nonsense; the submission is still
 * pending and may be verified again. It is never recorded as a rejection.
 */
public enum VerificationOutcome {

    /** Approved and a Payment was created. */
    @JsonProperty("approved")
    APPROVED,

    /** Approved, but the worker has no payout address; no Payment yet and the task stays open. */
    @JsonProperty("approved_unpaid")
    APPROVED_UNPAID,

    @JsonProperty("rejected")
    REJECTED,

    @JsonProperty("error")
    ERROR;

    public String label() {
        return name().toLowerCase();
    }
}
