package com.flagship.bounty_ledger.user.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class RegisterUserRequest {

    @NotBlank(message = "Username is required")
    @Size(max = 100, message = "Username must be at most 100 characters")
    @JsonProperty("username")
    String username;

    @NotBlank(message = "Password is required")
    @ToString.Exclude
    @JsonProperty("password")
    String password;

    @JsonProperty("wallet_address")
    String walletAddress;
}
