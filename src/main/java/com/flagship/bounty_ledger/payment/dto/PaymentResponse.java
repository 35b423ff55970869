package com.flagship.bounty_ledger.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bounty_ledger.payment.Payment;
import com.flagship.bounty_ledger.payment.PaymentStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class PaymentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("submission_id")
    UUID submissionId;

    @JsonProperty("task_id")
    UUID taskId;

    @JsonProperty("worker_id")
    UUID workerId;

    @JsonProperty("wallet_address")
    String walletAddress;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("status")
    PaymentStatus status;

    @JsonProperty("transaction_signature")
    String transactionSignature;

    @JsonProperty("error_message")
    String errorMessage;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("completed_at")
    Instant completedAt;

    public static PaymentResponse from(Payment payment) {
        return PaymentResponse.builder()
            .id(payment.getId())
            .submissionId(payment.getSubmissionId())
            .taskId(payment.getTaskId())
            .workerId(payment.getWorkerId())
            .walletAddress(payment.getWalletAddress())
            .amount(payment.getAmount())
            .status(payment.getStatus())
            .transactionSignature(payment.getTransactionSignature())
            .errorMessage(payment.getErrorMessage())
            .createdAt(payment.getCreatedAt())
            .completedAt(payment.getCompletedAt())
            .build();
    }
}
