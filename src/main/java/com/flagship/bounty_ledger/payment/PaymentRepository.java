package com.flagship.bounty_ledger.payment;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PaymentRepository extends JpaRepository<PaymentEntity, UUID> {

    Optional<PaymentEntity> findBySubmissionId(UUID submissionId);

    boolean existsBySubmissionId(UUID submissionId);

    List<PaymentEntity> findAllByOrderByCreatedAtDesc();

    List<PaymentEntity> findByStatusOrderByCreatedAtAsc(PaymentStatus status);

    List<PaymentEntity> findByWorkerIdOrderByCreatedAtDesc(UUID workerId);

    /**
     * PENDING → PROCESSING as a single conditional write. Returns 0 when another caller
     * got there first.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE PaymentEntity p SET p.status = com.flagship.bounty_ledger.payment.PaymentStatus.PROCESSING, "
            + "p.updatedAt = :now, p.version = p.version + 1 "
            + "WHERE p.id = :id AND p.status = com.flagship.bounty_ledger.payment.PaymentStatus.PENDING")
    int markProcessing(@Param("id") UUID id, @Param("now") Instant now);

    @Query("SELECT COALESCE(SUM(p.amount), 0) FROM PaymentEntity p WHERE p.status = :status")
    BigDecimal sumAmountByStatus(@Param("status") PaymentStatus status);
}
