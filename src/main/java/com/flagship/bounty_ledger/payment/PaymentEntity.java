package com.flagship.bounty_ledger.payment;

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

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for payments.
 *
 * The unique submission_id column is what guarantees at most one payment per submission, even
 * when two approvals race. Amount and destination are fixed at creation.
 */
@Entity
@Table(name = "payments")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PaymentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "submission_id", nullable = false, updatable = false, unique = true)
    private UUID submissionId;

    @Column(name = "task_id", nullable = false, updatable = false)
    private UUID taskId;

    @Column(name = "worker_id", nullable = false, updatable = false)
    private UUID workerId;

    @Column(name = "wallet_address", nullable = false, updatable = false, length = 64)
    private String walletAddress;

    @Column(nullable = false, updatable = false, precision = 18, scale = 9)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentStatus status;

    @Column(name = "transaction_signature", length = 128)
    private String transactionSignature;

    @Column(name = "error_message")
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private long version;

    static PaymentEntity fromDomain(Payment payment) {
        return new PaymentEntity(
            payment.getId(),
            payment.getSubmissionId(),
            payment.getTaskId(),
            payment.getWorkerId(),
            payment.getWalletAddress(),
            payment.getAmount(),
            payment.getStatus(),
            payment.getTransactionSignature(),
            payment.getErrorMessage(),
            payment.getCreatedAt(),
            payment.getCompletedAt(),
            payment.getUpdatedAt(),
            0L
        );
    }

    public Payment toDomain() {
        return new Payment(id, submissionId, taskId, workerId, walletAddress, amount, status,
                transactionSignature, errorMessage, createdAt, completedAt, updatedAt);
    }

    /**
     * Copies status, signature, error and timestamps from a validated transition.
     */
    void updateFromDomain(Payment payment) {
        if (!payment.getId().equals(this.id)) {
            throw new IllegalArgumentException("Payment id mismatch: " + payment.getId() + " vs " + this.id);
        }
        this.status = payment.getStatus();
        this.transactionSignature = payment.getTransactionSignature();
        this.errorMessage = payment.getErrorMessage();
        this.completedAt = payment.getCompletedAt();
        this.updatedAt = payment.getUpdatedAt();
    }
}
