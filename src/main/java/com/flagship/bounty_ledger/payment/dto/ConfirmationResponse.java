package com.flagship.bounty_ledger.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bounty_ledger.collaborator.Confirmation;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class ConfirmationResponse {

    @JsonProperty("signature")
    String signature;

    @JsonProperty("confirmed")
    boolean confirmed;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("from")
    String from;

    @JsonProperty("to")
    String to;

    public static ConfirmationResponse from(String signature, Confirmation confirmation) {
        return new ConfirmationResponse(signature, confirmation.isConfirmed(), confirmation.getAmount(),
                confirmation.getFrom(), confirmation.getTo());
    }
}
