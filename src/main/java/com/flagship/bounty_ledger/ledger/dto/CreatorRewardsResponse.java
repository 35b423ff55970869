package com.flagship.bounty_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bounty_ledger.collaborator.CreatorRewards;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
public class CreatorRewardsResponse {

    @JsonProperty("wallet_address")
    String walletAddress;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("claimable")
    BigDecimal claimable;

    @JsonProperty("last_updated")
    Instant lastUpdated;

    public static CreatorRewardsResponse from(CreatorRewards rewards) {
        return new CreatorRewardsResponse(rewards.getWalletAddress(), rewards.getBalance(),
                rewards.getClaimable(), rewards.getLastUpdated());
    }
}
