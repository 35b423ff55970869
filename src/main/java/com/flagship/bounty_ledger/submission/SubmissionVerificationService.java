package com.flagship.bounty_ledger.submission;

import com.flagship.bounty_ledger.collaborator.ApprovalJudge;
import com.flagship.bounty_ledger.collaborator.BoundedCaller;
import com.flagship.bounty_ledger.collaborator.Collaborator;
import com.flagship.bounty_ledger.collaborator.JudgeRequest;
import com.flagship.bounty_ledger.collaborator.JudgeVerdict;
import com.flagship.bounty_ledger.config.BountyProperties;
import com.flagship.bounty_ledger.exception.CollaboratorException;
import com.flagship.bounty_ledger.exception.ConflictException;
import com.flagship.bounty_ledger.exception.NotFoundException;
import com.flagship.bounty_ledger.observability.CorrelationContext;
import com.flagship.bounty_ledger.observability.OrchestrationMetrics;
import com.flagship.bounty_ledger.task.Task;
import com.flagship.bounty_ledger.task.TaskPersistenceService;
import com.flagship.bounty_ledger.task.TaskStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Drives pending submissions to a verdict through the approval judge.
 *
 * The judge call happens outside any transaction; the verdict and everything it implies are then
 * recorded by {@link VerdictRecorder} in one. A judge failure leaves the submission pending.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubmissionVerificationService {

    private final SubmissionPersistenceService persistenceService;
    private final TaskPersistenceService taskPersistenceService;
    private final VerdictRecorder verdictRecorder;
    private final ApprovalJudge approvalJudge;
    private final BoundedCaller boundedCaller;
    private final OrchestrationMetrics metrics;
    private final BountyProperties properties;

    /**
     * Verifies one pending submission.
     *
     * @throws NotFoundException if the submission or its task is missing
     * @throws ConflictException if the submission was already decided or its task was cancelled
     * @throws CollaboratorException if the judge failed; nothing was recorded
     */
    public VerificationResult verify(UUID submissionId) {
        MDC.put(CorrelationContext.SUBMISSION_ID_MDC_KEY, submissionId.toString());
        try {
            VerificationResult result = doVerify(submissionId);
            metrics.recordVerification(result.getOutcome().label());
            return result;
        } catch (CollaboratorException e) {
            metrics.recordVerification(VerificationOutcome.ERROR.label());
            log.warn("Verification of submission {} did not complete: {}", submissionId, e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.SUBMISSION_ID_MDC_KEY);
        }
    }

    /**
     * Verifies every pending submission, oldest first, one at a time. A failure on one item is
     * reported in its result and the rest carry on.
     */
    public List<VerificationResult> verifyAll() {
        List<Submission> pending = persistenceService.findPending();
        log.info("Verifying {} pending submissions", pending.size());

        List<VerificationResult> results = new ArrayList<>();
        for (Submission submission : pending) {
            try {
                results.add(verify(submission.getId()));
            } catch (CollaboratorException | ConflictException | NotFoundException e) {
                results.add(VerificationResult.error(submission.getId(), e.getMessage()));
            } catch (RuntimeException e) {
                log.error("Verification of submission {} aborted", submission.getId(), e);
                results.add(VerificationResult.error(submission.getId(), e.getMessage()));
            }
        }
        return results;
    }

    private VerificationResult doVerify(UUID submissionId) {
        Submission submission = persistenceService.get(submissionId);
        if (!submission.isPending()) {
            throw new ConflictException("Submission " + submissionId + " has already been "
                    + submission.getStatus().name().toLowerCase());
        }
        Task task = taskPersistenceService.get(submission.getTaskId());
        if (task.getStatus() == TaskStatus.CANCELLED) {
            throw new ConflictException("Task " + task.getId() + " was cancelled");
        }

        JudgeRequest request = JudgeRequest.builder()
                .taskTitle(task.getTitle())
                .taskDescription(task.getDescription())
                .taskType(task.getTaskType().label())
                .reward(task.getReward())
                .verificationCriteria(task.getVerificationCriteria())
                .proofType(submission.getProofType().label())
                .proofData(submission.getProofData())
                .proofDescription(submission.getProofDescription())
                .build();

        JudgeVerdict verdict = boundedCaller.call(Collaborator.APPROVAL_JUDGE,
                properties.getJudge().getTimeout(), () -> approvalJudge.evaluate(request));
        if (verdict == null) {
            throw new CollaboratorException(Collaborator.APPROVAL_JUDGE.getDisplayName(), "Judge returned no verdict");
        }

        return verdictRecorder.record(submissionId, task.getId(), verdict);
    }
}
