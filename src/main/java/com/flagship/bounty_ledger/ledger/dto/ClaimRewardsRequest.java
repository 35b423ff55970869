package com.flagship.bounty_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Empty body or no wallet address claims for the configured funding address.
 */
@Value
@Builder
@Jacksonized
public class ClaimRewardsRequest {

    @JsonProperty("wallet_address")
    String walletAddress;
}
