package com.flagship.bounty_ledger.payment.event;

import com.flagship.bounty_ledger.outbox.BountyEvent;
import com.flagship.bounty_ledger.payment.Payment;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class PaymentFailedEvent implements BountyEvent {
    public static final String EVENT_TYPE = "PaymentFailed";

    UUID eventId;
    UUID paymentId;
    UUID workerId;
    BigDecimal amount;
    String reason;
    String transactionSignature;   // set when a transfer was submitted but not confirmed
    Instant occurredAt;

    public static PaymentFailedEvent fromPayment(Payment payment) {
        return new PaymentFailedEvent(
            UUID.randomUUID(),
            payment.getId(),
            payment.getWorkerId(),
            payment.getAmount(),
            payment.getErrorMessage(),
            payment.getTransactionSignature(),
            payment.getUpdatedAt()
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
