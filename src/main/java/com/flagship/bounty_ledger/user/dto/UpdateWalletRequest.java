package com.flagship.bounty_ledger.user.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class UpdateWalletRequest {

    @NotBlank(message = "Wallet address is required")
    @JsonProperty("wallet_address")
    String walletAddress;
}
