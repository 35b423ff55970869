package com.flagship.bounty_ledger.task;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface TaskRepository extends JpaRepository<TaskEntity, UUID> {

    /**
     * Loads a task holding a row lock until the surrounding transaction ends.
     * Used where a cap check and the counter increment must not interleave.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM TaskEntity t WHERE t.id = :id")
    Optional<TaskEntity> findByIdForUpdate(@Param("id") UUID id);

    List<TaskEntity> findAllByOrderByCreatedAtDesc();

    List<TaskEntity> findByStatusOrderByCreatedAtAsc(TaskStatus status);

    long countByStatus(TaskStatus status);

    @Query("SELECT COALESCE(SUM(t.reward), 0) FROM TaskEntity t")
    BigDecimal sumRewards();
}
