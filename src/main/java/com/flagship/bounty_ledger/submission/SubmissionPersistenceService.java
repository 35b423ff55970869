package com.flagship.bounty_ledger.submission;

import com.flagship.bounty_ledger.exception.NotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class SubmissionPersistenceService {

    private final SubmissionRepository submissionRepository;

    @Transactional(propagation = Propagation.MANDATORY)
    public Submission save(Submission submission) {
        SubmissionEntity saved = submissionRepository.save(SubmissionEntity.fromDomain(submission));
        log.debug("Saved submission {}", saved.getId());
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public Submission get(UUID submissionId) {
        return submissionRepository.findById(submissionId)
                .map(SubmissionEntity::toDomain)
                .orElseThrow(() -> NotFoundException.of("Submission", submissionId));
    }

    /**
     * Records a verdict. The version check turns a concurrent second verdict into an
     * optimistic-lock failure instead of an overwrite.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Submission update(Submission submission) {
        SubmissionEntity existing = submissionRepository.findById(submission.getId())
                .orElseThrow(() -> NotFoundException.of("Submission", submission.getId()));
        existing.updateFromDomain(submission);
        SubmissionEntity updated = submissionRepository.saveAndFlush(existing);
        log.debug("Updated submission {} to status {}", updated.getId(), updated.getStatus());
        return updated.toDomain();
    }

    @Transactional(readOnly = true)
    public List<Submission> findPending() {
        return submissionRepository.findByStatusOrderBySubmittedAtAsc(SubmissionStatus.PENDING).stream()
                .map(SubmissionEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<Submission> findByTask(UUID taskId) {
        return submissionRepository.findByTaskIdOrderBySubmittedAtDesc(taskId).stream()
                .map(SubmissionEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<Submission> findByWorker(UUID workerId) {
        return submissionRepository.findByWorkerIdOrderBySubmittedAtDesc(workerId).stream()
                .map(SubmissionEntity::toDomain)
                .toList();
    }
}
