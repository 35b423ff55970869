package com.flagship.bounty_ledger.task;

import com.flagship.bounty_ledger.collaborator.BoundedCaller;
import com.flagship.bounty_ledger.collaborator.Collaborator;
import com.flagship.bounty_ledger.collaborator.TaskDraft;
import com.flagship.bounty_ledger.collaborator.TaskGenerator;
import com.flagship.bounty_ledger.config.BountyProperties;
import com.flagship.bounty_ledger.observability.OrchestrationMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns generated drafts into tasks. Each draft goes through the same validation as an operator's
 * task; drafts that fail it are skipped, not repaired.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TaskGenerationService {

    static final int MAX_COUNT = 20;

    private final TaskGenerator generator;
    private final TaskLifecycleService lifecycleService;
    private final BoundedCaller boundedCaller;
    private final OrchestrationMetrics metrics;
    private final BountyProperties properties;

    public List<Task> generate(String projectContext, BigDecimal budget, Integer count) {
        if (projectContext == null || projectContext.isBlank()) {
            throw new IllegalArgumentException("Project context is required");
        }
        if (budget == null || budget.signum() <= 0) {
            throw new IllegalArgumentException("Budget must be greater than 0");
        }
        int requested = count == null ? 5 : count;
        if (requested < 1 || requested > MAX_COUNT) {
            throw new IllegalArgumentException("Count must be between 1 and " + MAX_COUNT);
        }

        List<TaskDraft> drafts = boundedCaller.call(Collaborator.TASK_GENERATOR, properties.getJudge().getTimeout(),
                () -> generator.generate(projectContext.trim(), budget, requested));

        List<Task> created = new ArrayList<>();
        for (TaskDraft draft : drafts) {
            try {
                created.add(lifecycleService.create(draft.getTitle(), draft.getDescription(),
                        TaskType.fromLabel(draft.getTaskType()), draft.getReward(),
                        draft.getVerificationCriteria(), 1, null));
            } catch (IllegalArgumentException e) {
                log.warn("Skipping generated task '{}': {}", draft.getTitle(), e.getMessage());
            }
        }

        metrics.recordGeneratedDrafts(created.size(), drafts.size() - created.size());
        log.info("Generated {} of {} drafted tasks", created.size(), drafts.size());
        return created;
    }
}
