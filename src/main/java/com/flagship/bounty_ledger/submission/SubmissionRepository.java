package com.flagship.bounty_ledger.submission;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface SubmissionRepository extends JpaRepository<SubmissionEntity, UUID> {

    List<SubmissionEntity> findByStatusOrderBySubmittedAtAsc(SubmissionStatus status);

    List<SubmissionEntity> findByTaskIdOrderBySubmittedAtDesc(UUID taskId);

    List<SubmissionEntity> findByWorkerIdOrderBySubmittedAtDesc(UUID workerId);

    long countByStatus(SubmissionStatus status);
}
