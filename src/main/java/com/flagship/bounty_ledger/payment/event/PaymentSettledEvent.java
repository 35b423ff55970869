package com.flagship.bounty_ledger.payment.event;

import com.flagship.bounty_ledger.outbox.BountyEvent;
import com.flagship.bounty_ledger.payment.Payment;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A transfer was confirmed on the network and counted into the ledger and the worker's earnings.
 */
@Value
public class PaymentSettledEvent implements BountyEvent {
    public static final String EVENT_TYPE = "PaymentSettled";

    UUID eventId;
    UUID paymentId;
    UUID workerId;
    BigDecimal amount;
    String transactionSignature;
    Instant occurredAt;

    public static PaymentSettledEvent fromPayment(Payment payment) {
        return new PaymentSettledEvent(
            UUID.randomUUID(),
            payment.getId(),
            payment.getWorkerId(),
            payment.getAmount(),
            payment.getTransactionSignature(),
            payment.getCompletedAt()
        );
    }

    @Override
    public UUID getAggregateId() {
        return paymentId;
    }

    @Override
    public String getAggregateType() {
        return PaymentEvents.AGGREGATE_TYPE;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
