package com.flagship.bounty_ledger.exception;

import java.math.BigDecimal;

/**
 * A reward or payment amount is above its configured cap.
 */
public class LimitExceededException extends IllegalArgumentException {

    private final BigDecimal limit;

    public LimitExceededException(String message, BigDecimal limit) {
        super(message);
        this.limit = limit;
    }

    public BigDecimal getLimit() {
        return limit;
    }
}
