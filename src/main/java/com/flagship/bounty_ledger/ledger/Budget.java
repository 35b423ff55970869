package com.flagship.bounty_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * The singleton funding record. {@code totalPaidOut} only grows, and only by confirmed payments.
 */
@Value
public class Budget {
    String fundingAddress;
    BigDecimal balance;
    BigDecimal totalPaidOut;
    Instant lastUpdated;
}
