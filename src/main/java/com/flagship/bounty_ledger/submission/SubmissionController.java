package com.flagship.bounty_ledger.submission;

import com.flagship.bounty_ledger.payment.dto.PaymentResponse;
import com.flagship.bounty_ledger.submission.dto.BatchVerificationResponse;
import com.flagship.bounty_ledger.submission.dto.CreateSubmissionRequest;
import com.flagship.bounty_ledger.submission.dto.SubmissionResponse;
import com.flagship.bounty_ledger.submission.dto.VerificationResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Worker proof intake plus the admin verification endpoints.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class SubmissionController {

    private final SubmissionService submissionService;
    private final SubmissionVerificationService verificationService;
    private final VerdictRecorder verdictRecorder;

    @PostMapping("/api/submissions")
    public ResponseEntity<SubmissionResponse> submit(@Valid @RequestBody CreateSubmissionRequest request) {
        Submission submission = submissionService.submit(request.getTaskId(), request.getWorkerId(),
                request.getProofType(), request.getProofData(), request.getProofDescription());
        return ResponseEntity.status(HttpStatus.CREATED).body(SubmissionResponse.from(submission));
    }

    @GetMapping("/api/submissions/pending")
    public List<SubmissionResponse> listPending() {
        return submissionService.listPending().stream().map(SubmissionResponse::from).toList();
    }

    @GetMapping("/api/submissions/{id}")
    public SubmissionResponse getSubmission(@PathVariable("id") UUID id) {
        return SubmissionResponse.from(submissionService.getSubmission(id));
    }

    @PostMapping("/api/submissions/{id}/verify")
    public VerificationResponse verify(@PathVariable("id") UUID id) {
        return VerificationResponse.from(verificationService.verify(id));
    }

    /**
     * Pays an approved submission that was left unpaid for lack of a payout address.
     */
    @PostMapping("/api/submissions/{id}/payment")
    public ResponseEntity<PaymentResponse> issuePayment(@PathVariable("id") UUID id) {
        return ResponseEntity.status(HttpStatus.CREATED).body(PaymentResponse.from(verdictRecorder.issuePayment(id)));
    }

    @PostMapping("/api/verify/batch")
    public BatchVerificationResponse verifyAll() {
        BatchVerificationResponse response = BatchVerificationResponse.from(verificationService.verifyAll());
        log.info("Batch verification: processed={}, approved={}, rejected={}, errors={}",
                response.getProcessed(), response.getApproved(), response.getRejected(), response.getErrors());
        return response;
    }
}
