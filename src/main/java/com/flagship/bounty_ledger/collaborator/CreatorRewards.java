package com.flagship.bounty_ledger.collaborator;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
public class CreatorRewards {
    String walletAddress;
    BigDecimal balance;
    BigDecimal claimable;
    Instant lastUpdated;
}
