package com.flagship.bounty_ledger.payment.event;

import com.flagship.bounty_ledger.outbox.BountyEvent;
import com.flagship.bounty_ledger.payment.Payment;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A payment was created for an approved submission and is waiting for settlement.
 */
@Value
public class PaymentCreatedEvent implements BountyEvent {
    public static final String EVENT_TYPE = "PaymentCreated";

    UUID eventId;
    UUID paymentId;
    UUID submissionId;
    UUID taskId;
    UUID workerId;
    String walletAddress;
    BigDecimal amount;
    Instant occurredAt;

    public static PaymentCreatedEvent fromPayment(Payment payment) {
        return new PaymentCreatedEvent(
            UUID.randomUUID(),
            payment.getId(),
            payment.getSubmissionId(),
            payment.getTaskId(),
            payment.getWorkerId(),
            payment.getWalletAddress(),
            payment.getAmount(),
            payment.getCreatedAt()
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
