package com.flagship.bounty_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One confirmed payment counted into the paid-out total. Keyed by payment id, written once.
 */
@Value
public class LedgerAccrual {
    UUID paymentId;
    UUID workerId;
    BigDecimal amount;
    Instant accruedAt;
}
