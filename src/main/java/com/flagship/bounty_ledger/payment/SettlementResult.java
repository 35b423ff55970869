package com.flagship.bounty_ledger.payment;

import lombok.Value;

import java.util.UUID;

/**
 * Outcome of one settlement attempt. {@code failure} says why a payment did not complete.
 */
@Value
public class SettlementResult {

    public enum Failure {
        /** Refused before any external call: amount or address. */
        VALIDATION,
        /** Amount above the per-transfer cap. */
        LIMIT_EXCEEDED,
        /** The funds executor declined, failed or timed out. */
        TRANSFER,
        /** A transfer was submitted but could not be confirmed. */
        NOT_CONFIRMED,
        /** The payment was not pending. */
        CONFLICT,
        /** Settlement aborted unexpectedly; the payment may be left PROCESSING. */
        ERROR
    }

    UUID paymentId;
    PaymentStatus status;
    String signature;
    String error;
    Failure failure;

    public static SettlementResult completed(Payment payment) {
        return new SettlementResult(payment.getId(), payment.getStatus(), payment.getTransactionSignature(),
                null, null);
    }

    public static SettlementResult failed(Payment payment, Failure failure) {
        return new SettlementResult(payment.getId(), payment.getStatus(), payment.getTransactionSignature(),
                payment.getErrorMessage(), failure);
    }

    public static SettlementResult conflict(UUID paymentId, PaymentStatus status, String error) {
        return new SettlementResult(paymentId, status, null, error, Failure.CONFLICT);
    }

    public static SettlementResult error(UUID paymentId, PaymentStatus status, String error) {
        return new SettlementResult(paymentId, status, null, error, Failure.ERROR);
    }

    public boolean isSuccess() {
        return status == PaymentStatus.COMPLETED && failure == null;
    }
}
