package com.flagship.bounty_ledger.task;

import com.flagship.bounty_ledger.exception.NotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Bridges the Task domain object and its JPA entity.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TaskPersistenceService {

    private final TaskRepository taskRepository;

    @Transactional
    public Task save(Task task) {
        TaskEntity saved = taskRepository.save(TaskEntity.fromDomain(task));
        log.debug("Saved task {}", saved.getId());
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public Task get(UUID taskId) {
        return taskRepository.findById(taskId)
                .map(TaskEntity::toDomain)
                .orElseThrow(() -> NotFoundException.of("Task", taskId));
    }

    /**
     * Loads the task under a row lock held until the caller's transaction ends.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Task getForUpdate(UUID taskId) {
        return taskRepository.findByIdForUpdate(taskId)
                .map(TaskEntity::toDomain)
                .orElseThrow(() -> NotFoundException.of("Task", taskId));
    }

    /**
     * Writes a validated transition back. No setters: the entity copies the mutable fields.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Task update(Task task) {
        TaskEntity existing = taskRepository.findById(task.getId())
                .orElseThrow(() -> NotFoundException.of("Task", task.getId()));
        existing.updateFromDomain(task);
        TaskEntity updated = taskRepository.saveAndFlush(existing);
        log.debug("Updated task {} to status {}", updated.getId(), updated.getStatus());
        return updated.toDomain();
    }

    @Transactional(readOnly = true)
    public List<Task> findAllNewestFirst() {
        return taskRepository.findAllByOrderByCreatedAtDesc().stream()
                .map(TaskEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<Task> findByStatus(TaskStatus status) {
        return taskRepository.findByStatusOrderByCreatedAtAsc(status).stream()
                .map(TaskEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public long count() {
        return taskRepository.count();
    }

    @Transactional(readOnly = true)
    public long countByStatus(TaskStatus status) {
        return taskRepository.countByStatus(status);
    }

    @Transactional(readOnly = true)
    public BigDecimal sumRewards() {
        return taskRepository.sumRewards();
    }
}
