package com.flagship.bounty_ledger.payment;

import com.flagship.bounty_ledger.exception.ConflictException;
import com.flagship.bounty_ledger.exception.NotFoundException;
import com.flagship.bounty_ledger.outbox.OutboxService;
import com.flagship.bounty_ledger.payment.event.PaymentFailedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Bridges the Payment domain object and its entity, and commits the settlement flow's
 * intermediate transitions. Each public write is its own short transaction, so each step of a
 * settlement is durable before the next external call starts.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentPersistenceService {

    private final PaymentRepository paymentRepository;
    private final OutboxService outboxService;

    @Transactional(propagation = Propagation.MANDATORY)
    public Payment save(Payment payment) {
        PaymentEntity saved = paymentRepository.save(PaymentEntity.fromDomain(payment));
        log.debug("Saved payment {} for submission {}", saved.getId(), saved.getSubmissionId());
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public Payment get(UUID paymentId) {
        return paymentRepository.findById(paymentId)
                .map(PaymentEntity::toDomain)
                .orElseThrow(() -> NotFoundException.of("Payment", paymentId));
    }

    @Transactional(readOnly = true)
    public Optional<Payment> findBySubmission(UUID submissionId) {
        return paymentRepository.findBySubmissionId(submissionId).map(PaymentEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public boolean existsForSubmission(UUID submissionId) {
        return paymentRepository.existsBySubmissionId(submissionId);
    }

    /**
     * PENDING → PROCESSING. The conditional update makes this the single commitment point:
     * of two concurrent settlers exactly one gets here.
     *
     * @throws ConflictException if the payment is no longer pending
     */
    @Transactional
    public Payment markProcessing(UUID paymentId) {
        int updated = paymentRepository.markProcessing(paymentId, Instant.now());
        Payment payment = get(paymentId);
        if (updated == 0) {
            throw new ConflictException(
                "Payment " + paymentId + " is " + payment.getStatus().name().toLowerCase() + ", not pending");
        }
        return payment;
    }

    /**
     * Terminal failure with the reason retained. Writes a PaymentFailed event.
     */
    @Transactional
    public Payment markFailed(UUID paymentId, String reason, String signature) {
        PaymentEntity entity = paymentRepository.findById(paymentId)
                .orElseThrow(() -> NotFoundException.of("Payment", paymentId));
        Payment failed = entity.toDomain().fail(reason, signature);
        entity.updateFromDomain(failed);
        paymentRepository.saveAndFlush(entity);
        outboxService.saveEvent(PaymentFailedEvent.fromPayment(failed));
        log.warn("Payment {} failed: {}", paymentId, reason);
        return failed;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public Payment update(Payment payment) {
        PaymentEntity existing = paymentRepository.findById(payment.getId())
                .orElseThrow(() -> NotFoundException.of("Payment", payment.getId()));
        existing.updateFromDomain(payment);
        return paymentRepository.saveAndFlush(existing).toDomain();
    }

    @Transactional(readOnly = true)
    public List<Payment> findAllNewestFirst() {
        return paymentRepository.findAllByOrderByCreatedAtDesc().stream()
                .map(PaymentEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<Payment> findPending() {
        return paymentRepository.findByStatusOrderByCreatedAtAsc(PaymentStatus.PENDING).stream()
                .map(PaymentEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<Payment> findByWorker(UUID workerId) {
        return paymentRepository.findByWorkerIdOrderByCreatedAtDesc(workerId).stream()
                .map(PaymentEntity::toDomain)
                .toList();
    }
}
