package com.flagship.bounty_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bounty_ledger.collaborator.RewardsClaim;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class ClaimRewardsResponse {

    @JsonProperty("success")
    boolean success;

    @JsonProperty("signature")
    String signature;

    @JsonProperty("amount_claimed")
    BigDecimal amountClaimed;

    @JsonProperty("error")
    String error;

    public static ClaimRewardsResponse from(RewardsClaim claim) {
        return new ClaimRewardsResponse(claim.isSuccess(), claim.getSignature(), claim.getAmountClaimed(),
                claim.getError());
    }
}
