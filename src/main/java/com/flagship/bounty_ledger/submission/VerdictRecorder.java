package com.flagship.bounty_ledger.submission;

import com.flagship.bounty_ledger.collaborator.JudgeVerdict;
import com.flagship.bounty_ledger.exception.ConflictException;
import com.flagship.bounty_ledger.outbox.OutboxService;
import com.flagship.bounty_ledger.payment.Payment;
import com.flagship.bounty_ledger.payment.PaymentService;
import com.flagship.bounty_ledger.submission.event.SubmissionApprovedEvent;
import com.flagship.bounty_ledger.submission.event.SubmissionRejectedEvent;
import com.flagship.bounty_ledger.task.Task;
import com.flagship.bounty_ledger.task.TaskLifecycleService;
import com.flagship.bounty_ledger.task.TaskPersistenceService;
import com.flagship.bounty_ledger.task.TaskStatus;
import com.flagship.bounty_ledger.user.User;
import com.flagship.bounty_ledger.user.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Records a judge verdict and its consequences in one transaction, under the task's row lock.
 *
 * Approval: submission APPROVED, one Payment for the task reward, task completed once its cap is
 * reached. A worker without a payout address gets APPROVED_UNPAID instead: no Payment and the
 * task is left as it is until {@link #issuePayment(UUID)} runs.
 * Rejection: submission REJECTED and its slot given back to the task.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VerdictRecorder {

    private final SubmissionPersistenceService persistenceService;
    private final TaskPersistenceService taskPersistenceService;
    private final TaskLifecycleService taskLifecycleService;
    private final PaymentService paymentService;
    private final UserService userService;
    private final OutboxService outboxService;

    @Transactional
    public VerificationResult record(UUID submissionId, UUID taskId, JudgeVerdict verdict) {
        Task task = taskPersistenceService.getForUpdate(taskId);
        if (task.getStatus() == TaskStatus.CANCELLED) {
            throw new ConflictException("Task " + taskId + " was cancelled");
        }

        Submission decided = persistenceService.update(persistenceService.get(submissionId).decide(verdict));

        if (!decided.isApproved()) {
            outboxService.saveEvent(SubmissionRejectedEvent.fromSubmission(decided));
            taskLifecycleService.releaseSubmissionSlot(taskId);
            log.info("Submission {} rejected with score {}", submissionId, decided.getVerdictScore());
            return VerificationResult.decided(submissionId, VerificationOutcome.REJECTED, verdict, null);
        }

        outboxService.saveEvent(SubmissionApprovedEvent.fromSubmission(decided));
        User worker = userService.getUser(decided.getWorkerId());
        if (!worker.hasPayoutAddress()) {
            log.warn("Submission {} approved but worker {} has no payout address; payment deferred",
                    submissionId, worker.getId());
            return VerificationResult.decided(submissionId, VerificationOutcome.APPROVED_UNPAID, verdict, null);
        }

        Payment payment = paymentService.createForApprovedSubmission(decided, task, worker);
        taskLifecycleService.completeOnApproval(taskId);
        log.info("Submission {} approved with score {}, payment {}", submissionId, decided.getVerdictScore(),
                payment.getId());
        return VerificationResult.decided(submissionId, VerificationOutcome.APPROVED, verdict, payment.getId());
    }

    /**
     * Creates the deferred Payment for an approved submission whose worker has since set a
     * payout address, then applies the approval-path task completion.
     *
     * @throws ConflictException if the submission is not approved, already paid, the worker still
     *         has no payout address, or the task was cancelled
     */
    @Transactional
    public Payment issuePayment(UUID submissionId) {
        Submission submission = persistenceService.get(submissionId);
        if (!submission.isApproved()) {
            throw new ConflictException("Submission " + submissionId + " is "
                    + submission.getStatus().name().toLowerCase() + ", not approved");
        }
        Task task = taskPersistenceService.getForUpdate(submission.getTaskId());
        if (task.getStatus() == TaskStatus.CANCELLED) {
            throw new ConflictException("Task " + task.getId() + " was cancelled");
        }

        Payment payment = paymentService.createForApprovedSubmission(
                submission, task, userService.getUser(submission.getWorkerId()));
        taskLifecycleService.completeOnApproval(task.getId());
        log.info("Deferred payment {} issued for submission {}", payment.getId(), submissionId);
        return payment;
    }
}
