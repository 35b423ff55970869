package com.flagship.bounty_ledger.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bounty_ledger.payment.PaymentStatus;
import com.flagship.bounty_ledger.payment.SettlementResult;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * One payment's settlement outcome.
 */
@Value
@Builder
public class SettlementResponse {

    @JsonProperty("payment_id")
    UUID paymentId;

    @JsonProperty("success")
    boolean success;

    @JsonProperty("status")
    PaymentStatus status;

    @JsonProperty("signature")
    String signature;

    @JsonProperty("error")
    String error;

    @JsonProperty("failure")
    SettlementResult.Failure failure;

    public static SettlementResponse from(SettlementResult result) {
        return SettlementResponse.builder()
            .paymentId(result.getPaymentId())
            .success(result.isSuccess())
            .status(result.getStatus())
            .signature(result.getSignature())
            .error(result.getError())
            .failure(result.getFailure())
            .build();
    }
}
