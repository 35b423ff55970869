package com.flagship.bounty_ledger.payment.event;

public final class PaymentEvents {

    public static final String AGGREGATE_TYPE = "Payment";

    private PaymentEvents() {
    }
}
