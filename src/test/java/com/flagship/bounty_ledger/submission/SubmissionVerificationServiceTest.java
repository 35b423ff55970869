package com.flagship.bounty_ledger.submission;

import com.flagship.bounty_ledger.BountyFixtures;
import com.flagship.bounty_ledger.IntegrationTestSupport;
import com.flagship.bounty_ledger.collaborator.JudgeRequest;
import com.flagship.bounty_ledger.exception.CollaboratorException;
import com.flagship.bounty_ledger.exception.ConflictException;
import com.flagship.bounty_ledger.exception.NotFoundException;
import com.flagship.bounty_ledger.outbox.OutboxService;
import com.flagship.bounty_ledger.payment.Payment;
import com.flagship.bounty_ledger.payment.PaymentPersistenceService;
import com.flagship.bounty_ledger.payment.PaymentStatus;
import com.flagship.bounty_ledger.submission.event.SubmissionApprovedEvent;
import com.flagship.bounty_ledger.task.Task;
import com.flagship.bounty_ledger.task.TaskLifecycleService;
import com.flagship.bounty_ledger.task.TaskStatus;
import com.flagship.bounty_ledger.user.User;
import com.flagship.bounty_ledger.user.UserService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SubmissionVerificationServiceTest extends IntegrationTestSupport {

    @Autowired
    private SubmissionVerificationService verificationService;

    @Autowired
    private VerdictRecorder verdictRecorder;

    @Autowired
    private SubmissionService submissionService;

    @Autowired
    private TaskLifecycleService taskLifecycleService;

    @Autowired
    private PaymentPersistenceService paymentPersistenceService;

    @Autowired
    private UserService userService;

    @Autowired
    private OutboxService outboxService;

    @Test
    @DisplayName("Approval creates one pending payment for the task reward and completes the task")
    void verify_Approved_CreatesPaymentAndCompletesTask() {
        User worker = fixtures.worker();
        Task task = fixtures.task("0.05", 1);
        taskLifecycleService.claim(task.getId(), worker.getId());
        Submission submission = fixtures.submission(task, worker);
        when(approvalJudge.evaluate(any())).thenReturn(BountyFixtures.approved(92));

        VerificationResult result = verificationService.verify(submission.getId());

        assertEquals(VerificationOutcome.APPROVED, result.getOutcome());
        assertEquals(92, result.getScore());

        Submission decided = submissionService.getSubmission(submission.getId());
        assertEquals(SubmissionStatus.APPROVED, decided.getStatus());
        assertEquals(92, decided.getVerdictScore());
        assertNotNull(decided.getVerifiedAt());

        Payment payment = paymentPersistenceService.findBySubmission(submission.getId()).orElseThrow();
        assertEquals(result.getPaymentId(), payment.getId());
        assertEquals(PaymentStatus.PENDING, payment.getStatus());
        assertEquals(0, new BigDecimal("0.05").compareTo(payment.getAmount()));
        assertEquals(BountyFixtures.WORKER_WALLET, payment.getWalletAddress());

        assertEquals(TaskStatus.COMPLETED, taskLifecycleService.getTask(task.getId()).getStatus());
    }

    @Test
    @DisplayName("The judge sees the task requirements and the proof")
    void verify_PassesRequirementsAndProofToJudge() {
        User worker = fixtures.worker();
        Task task = fixtures.task("0.05", 1);
        Submission submission = fixtures.submission(task, worker);
        when(approvalJudge.evaluate(any())).thenReturn(BountyFixtures.rejected(20));

        verificationService.verify(submission.getId());

        ArgumentCaptor<JudgeRequest> captor = ArgumentCaptor.forClass(JudgeRequest.class);
        verify(approvalJudge).evaluate(captor.capture());
        JudgeRequest request = captor.getValue();
        assertEquals(task.getTitle(), request.getTaskTitle());
        assertEquals(task.getVerificationCriteria(), request.getVerificationCriteria());
        assertEquals("social", request.getTaskType());
        assertEquals("url", request.getProofType());
        assertEquals(submission.getProofData(), request.getProofData());
        assertEquals("Posted it", request.getProofDescription());
    }

    @Test
    @DisplayName("A judge failure leaves the submission pending, creates nothing and is not a rejection")
    void verify_JudgeFailure_SubmissionStaysPending() {
        User worker = fixtures.worker();
        Task task = fixtures.task("0.05", 1);
        taskLifecycleService.claim(task.getId(), worker.getId());
        Submission submission = fixtures.submission(task, worker);
        when(approvalJudge.evaluate(any()))
                .thenThrow(new CollaboratorException("Approval judge", "Anthropic API returned 529"));

        CollaboratorException e = assertThrows(CollaboratorException.class,
                () -> verificationService.verify(submission.getId()));
        assertTrue(e.getMessage().contains("529"));

        Submission unchanged = submissionService.getSubmission(submission.getId());
        assertEquals(SubmissionStatus.PENDING, unchanged.getStatus());
        assertNull(unchanged.getVerifiedAt());
        assertTrue(paymentPersistenceService.findBySubmission(submission.getId()).isEmpty());
        assertEquals(TaskStatus.PENDING_VERIFICATION, taskLifecycleService.getTask(task.getId()).getStatus());

        // a retry after the judge recovers goes through
        when(approvalJudge.evaluate(any())).thenReturn(BountyFixtures.approved(80));
        assertEquals(VerificationOutcome.APPROVED, verificationService.verify(submission.getId()).getOutcome());
    }

    @Test
    @DisplayName("Rejection gives the slot back so another submission can be made")
    void verify_Rejected_ReleasesSlot() {
        User worker = fixtures.worker();
        Task task = fixtures.task("0.05", 1);
        taskLifecycleService.claim(task.getId(), worker.getId());
        Submission first = fixtures.submission(task, worker);
        when(approvalJudge.evaluate(any())).thenReturn(BountyFixtures.rejected(15));

        VerificationResult result = verificationService.verify(first.getId());

        assertEquals(VerificationOutcome.REJECTED, result.getOutcome());
        assertEquals(List.of("Post publicly"), result.getSuggestions());
        assertTrue(paymentPersistenceService.findBySubmission(first.getId()).isEmpty());

        Task afterRejection = taskLifecycleService.getTask(task.getId());
        assertEquals(TaskStatus.IN_PROGRESS, afterRejection.getStatus());
        assertEquals(0, afterRejection.getCurrentSubmissions());

        Submission second = fixtures.submission(task, worker);
        assertEquals(SubmissionStatus.PENDING, second.getStatus());
    }

    @Test
    @DisplayName("A decided submission cannot be verified again and the judge is not called")
    void verify_AlreadyDecided_Conflict() {
        User worker = fixtures.worker();
        Task task = fixtures.task("0.05", 2);
        Submission submission = fixtures.submission(task, worker);
        when(approvalJudge.evaluate(any())).thenReturn(BountyFixtures.approved(70));
        verificationService.verify(submission.getId());

        assertThrows(ConflictException.class, () -> verificationService.verify(submission.getId()));

        verify(approvalJudge).evaluate(any());
        assertEquals(1, paymentPersistenceService.findByWorker(worker.getId()).size());
    }

    @Test
    @DisplayName("Submissions of a cancelled task are not sent to the judge")
    void verify_CancelledTask_Conflict() {
        User worker = fixtures.worker();
        Task task = fixtures.task("0.05", 1);
        Submission submission = fixtures.submission(task, worker);
        taskLifecycleService.cancel(task.getId());

        assertThrows(ConflictException.class, () -> verificationService.verify(submission.getId()));
        verify(approvalJudge, never()).evaluate(any());
    }

    @Test
    @DisplayName("Unknown submission is not found")
    void verify_Unknown_NotFound() {
        assertThrows(NotFoundException.class, () -> verificationService.verify(UUID.randomUUID()));
    }

    @Test
    @DisplayName("Approval for a worker without a payout address is reported as approved_unpaid")
    void verify_NoPayoutAddress_ApprovedUnpaid() {
        User worker = fixtures.workerWithoutWallet();
        Task task = fixtures.task("0.05", 1);
        Submission submission = fixtures.submission(task, worker);
        when(approvalJudge.evaluate(any())).thenReturn(BountyFixtures.approved(88));

        VerificationResult result = verificationService.verify(submission.getId());

        assertEquals(VerificationOutcome.APPROVED_UNPAID, result.getOutcome());
        assertNull(result.getPaymentId());
        assertEquals(SubmissionStatus.APPROVED, submissionService.getSubmission(submission.getId()).getStatus());
        assertTrue(paymentPersistenceService.findBySubmission(submission.getId()).isEmpty());
        assertEquals(TaskStatus.PENDING_VERIFICATION, taskLifecycleService.getTask(task.getId()).getStatus());

        // still unpayable
        assertThrows(ConflictException.class, () -> verdictRecorder.issuePayment(submission.getId()));

        userService.setPayoutAddress(worker.getId(), BountyFixtures.WORKER_WALLET);
        Payment payment = verdictRecorder.issuePayment(submission.getId());

        assertEquals(PaymentStatus.PENDING, payment.getStatus());
        assertEquals(0, new BigDecimal("0.05").compareTo(payment.getAmount()));
        assertEquals(TaskStatus.COMPLETED, taskLifecycleService.getTask(task.getId()).getStatus());
        assertThrows(ConflictException.class, () -> verdictRecorder.issuePayment(submission.getId()));
    }

    @Test
    @DisplayName("Approval below the cap keeps the task open for more submissions")
    void verify_ApprovedBelowCap_TaskStaysOpen() {
        Task task = fixtures.task("0.05", 3);
        Submission submission = fixtures.submission(task, fixtures.worker());
        when(approvalJudge.evaluate(any())).thenReturn(BountyFixtures.approved(95));

        verificationService.verify(submission.getId());

        Task after = taskLifecycleService.getTask(task.getId());
        assertEquals(TaskStatus.OPEN, after.getStatus());
        assertEquals(1, after.getCurrentSubmissions());
    }

    @Test
    @DisplayName("Verdicts are written to the outbox with the submission")
    void verify_WritesOutboxEvent() {
        Task task = fixtures.task("0.05", 1);
        Submission submission = fixtures.submission(task, fixtures.worker());
        when(approvalJudge.evaluate(any())).thenReturn(BountyFixtures.approved(91));

        verificationService.verify(submission.getId());

        assertTrue(outboxService.getEventsForAggregate(submission.getId()).stream()
                .anyMatch(event -> SubmissionApprovedEvent.EVENT_TYPE.equals(event.getEventType())));
    }

    @Test
    @DisplayName("Batch verification isolates a judge failure to its own item")
    void verifyAll_IsolatesFailures() {
        Submission approved = fixtures.submission(fixtures.task("0.05", 1), fixtures.worker());
        Submission failing = fixtures.submission(fixtures.task("0.05", 1), fixtures.worker());
        Submission rejected = fixtures.submission(fixtures.task("0.05", 1), fixtures.worker());

        when(approvalJudge.evaluate(any())).thenReturn(BountyFixtures.approved(50));
        when(approvalJudge.evaluate(argThat((JudgeRequest r) -> r != null && failing.getProofData().equals(r.getProofData()))))
                .thenThrow(new CollaboratorException("Approval judge", "timed out"));
        when(approvalJudge.evaluate(argThat((JudgeRequest r) -> r != null && rejected.getProofData().equals(r.getProofData()))))
                .thenReturn(BountyFixtures.rejected(5));

        Map<UUID, VerificationResult> results = verificationService.verifyAll().stream()
                .collect(Collectors.toMap(VerificationResult::getSubmissionId, Function.identity()));

        assertEquals(VerificationOutcome.APPROVED, results.get(approved.getId()).getOutcome());
        assertEquals(VerificationOutcome.REJECTED, results.get(rejected.getId()).getOutcome());
        VerificationResult error = results.get(failing.getId());
        assertEquals(VerificationOutcome.ERROR, error.getOutcome());
        assertTrue(error.getError().contains("timed out"));

        assertEquals(SubmissionStatus.PENDING, submissionService.getSubmission(failing.getId()).getStatus());
        assertTrue(paymentPersistenceService.findBySubmission(approved.getId()).isPresent());
    }
}
