package com.flagship.bounty_ledger.user.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bounty_ledger.user.User;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Public profile. The password hash never leaves the service.
 */
@Value
@Builder
public class UserResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("username")
    String username;

    @JsonProperty("wallet_address")
    String walletAddress;

    @JsonProperty("total_earnings")
    BigDecimal totalEarnings;

    @JsonProperty("tasks_completed")
    int tasksCompleted;

    @JsonProperty("created_at")
    Instant createdAt;

    public static UserResponse from(User user) {
        return UserResponse.builder()
            .id(user.getId())
            .username(user.getUsername())
            .walletAddress(user.getWalletAddress())
            .totalEarnings(user.getTotalEarnings())
            .tasksCompleted(user.getTasksCompleted())
            .createdAt(user.getCreatedAt())
            .build();
    }
}
