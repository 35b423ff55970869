package com.flagship.bounty_ledger.payment;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Payment lifecycle. Monotonic: PENDING → PROCESSING → {COMPLETED, FAILED}, and PENDING → FAILED
 * when settlement validation refuses the payment before any transfer.
 */
public enum PaymentStatus {
    @JsonProperty("pending")
    PENDING,
    @JsonProperty("processing")
    PROCESSING,
    @JsonProperty("completed")
    COMPLETED,
    @JsonProperty("failed")
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(PaymentStatus target) {
        return switch (this) {
            case PENDING -> target == PROCESSING || target == FAILED;
            case PROCESSING -> target == COMPLETED || target == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }
}
