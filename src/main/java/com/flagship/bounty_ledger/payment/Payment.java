package com.flagship.bounty_ledger.payment;

import com.flagship.bounty_ledger.exception.ConflictException;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Payment domain object: the transfer owed for one approved submission.
 *
 * Immutable. The amount is copied from the task reward at creation and never changes.
 * Transitions are validated against {@link PaymentStatus#canTransitionTo}; a failed payment is
 * terminal and is not retried.
 */
@Value
public class Payment {
    UUID id;
    UUID submissionId;
    UUID taskId;
    UUID workerId;
    String walletAddress;
    BigDecimal amount;
    PaymentStatus status;
    String transactionSignature;
    String errorMessage;
    Instant createdAt;
    Instant completedAt;
    Instant updatedAt;

    public static Payment create(UUID submissionId, UUID taskId, UUID workerId,
                                 String walletAddress, BigDecimal amount) {
        Instant now = Instant.now();
        return new Payment(UUID.randomUUID(), submissionId, taskId, workerId, walletAddress, amount,
                PaymentStatus.PENDING, null, null, now, null, now);
    }

    /**
     * The commitment point: from here the transfer is assumed in flight.
     */
    public Payment startProcessing() {
        return transition(PaymentStatus.PROCESSING, null, null, null);
    }

    public Payment complete(String signature) {
        if (signature == null || signature.isBlank()) {
            throw new IllegalArgumentException("A completed payment needs a settlement signature");
        }
        return transition(PaymentStatus.COMPLETED, signature, null, Instant.now());
    }

    /**
     * Terminal failure. A signature, if the transfer produced one, is kept for inspection.
     */
    public Payment fail(String reason, String signature) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("Failure reason is required");
        }
        return transition(PaymentStatus.FAILED, signature, reason, null);
    }

    public boolean isPending() {
        return status == PaymentStatus.PENDING;
    }

    private Payment transition(PaymentStatus target, String signature, String error, Instant completed) {
        if (!status.canTransitionTo(target)) {
            throw new ConflictException(
                String.format("Cannot move payment %s from %s to %s", id, status, target));
        }
        return new Payment(id, submissionId, taskId, workerId, walletAddress, amount, target,
                signature, error, createdAt, completed, Instant.now());
    }
}
