package com.flagship.bounty_ledger.payment;

import com.flagship.bounty_ledger.exception.ConflictException;
import com.flagship.bounty_ledger.outbox.OutboxService;
import com.flagship.bounty_ledger.payment.event.PaymentCreatedEvent;
import com.flagship.bounty_ledger.submission.Submission;
import com.flagship.bounty_ledger.task.Task;
import com.flagship.bounty_ledger.user.User;
import com.flagship.bounty_ledger.user.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Creates payments for approved submissions and serves payment lookups.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentService {

    private final PaymentPersistenceService persistenceService;
    private final OutboxService outboxService;
    private final UserService userService;

    /**
     * Creates the one payment owed for an approved submission, amount copied from the task reward.
     * Runs inside the verdict's transaction; the unique submission_id column backs the
     * existence check against a concurrent approval.
     *
     * @throws ConflictException if the submission is not approved or already has a payment
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Payment createForApprovedSubmission(Submission submission, Task task, User worker) {
        if (!submission.isApproved()) {
            throw new ConflictException("Submission " + submission.getId() + " is not approved");
        }
        if (!submission.getTaskId().equals(task.getId()) || !submission.getWorkerId().equals(worker.getId())) {
            throw new IllegalArgumentException("Submission " + submission.getId() + " does not match task or worker");
        }
        if (!worker.hasPayoutAddress()) {
            throw new ConflictException("Worker " + worker.getId() + " has no payout address");
        }
        if (persistenceService.existsForSubmission(submission.getId())) {
            throw new ConflictException("Submission " + submission.getId() + " already has a payment");
        }

        Payment payment = persistenceService.save(Payment.create(
                submission.getId(), task.getId(), worker.getId(), worker.getWalletAddress(), task.getReward()));
        outboxService.saveEvent(PaymentCreatedEvent.fromPayment(payment));

        log.info("Payment {} created for submission {}: amount={}", payment.getId(), submission.getId(),
                payment.getAmount().toPlainString());
        return payment;
    }

    public Payment getPayment(UUID paymentId) {
        return persistenceService.get(paymentId);
    }

    public List<Payment> listPayments() {
        return persistenceService.findAllNewestFirst();
    }

    public List<Payment> listPending() {
        return persistenceService.findPending();
    }

    public List<Payment> listForWorker(UUID workerId) {
        userService.getUser(workerId);
        return persistenceService.findByWorker(workerId);
    }
}
