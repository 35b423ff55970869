package com.flagship.bounty_ledger.user;

import lombok.Value;
import lombok.With;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A worker account. Earnings only grow, and only through a confirmed payment.
 */
@Value
@With
public class User {
    UUID id;
    String username;
    String passwordHash;
    String walletAddress;
    BigDecimal totalEarnings;
    int tasksCompleted;
    Instant createdAt;

    public static User register(String username, String passwordHash, String walletAddress) {
        return new User(UUID.randomUUID(), username, passwordHash, walletAddress,
                BigDecimal.ZERO, 0, Instant.now());
    }

    public boolean hasPayoutAddress() {
        return walletAddress != null && !walletAddress.isBlank();
    }

    public User recordEarning(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Earning amount must be positive");
        }
        return withTotalEarnings(totalEarnings.add(amount)).withTasksCompleted(tasksCompleted + 1);
    }
}
