package com.flagship.bounty_ledger.collaborator;

import java.math.BigDecimal;

/**
 * Moves funds from the funding address to a payout address.
 *
 * A declined transfer is reported through {@link TransferResult#isSuccess()}; an executor that
 * cannot be reached throws.
 */
public interface FundsExecutor {

    TransferResult transfer(String destinationAddress, BigDecimal amount);
}
