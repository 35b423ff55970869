package com.flagship.bounty_ledger.stats;

import com.flagship.bounty_ledger.task.TaskPersistenceService;
import com.flagship.bounty_ledger.task.TaskStatus;
import com.flagship.bounty_ledger.user.UserService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Public board figures. Total rewards are summed over every task regardless of status.
 */
@RestController
@RequiredArgsConstructor
public class StatsController {

    private static final int REWARD_DISPLAY_SCALE = 4;

    private final TaskPersistenceService taskPersistenceService;
    private final UserService userService;

    @GetMapping("/api/stats")
    public StatsResponse stats() {
        BigDecimal totalRewards = taskPersistenceService.sumRewards();
        StatsResponse.TaskStats tasks = new StatsResponse.TaskStats(
                taskPersistenceService.count(),
                taskPersistenceService.countByStatus(TaskStatus.OPEN),
                taskPersistenceService.countByStatus(TaskStatus.COMPLETED),
                (totalRewards == null ? BigDecimal.ZERO : totalRewards).setScale(REWARD_DISPLAY_SCALE, RoundingMode.HALF_UP));
        return new StatsResponse(tasks, new StatsResponse.WorkerStats(userService.countUsers()));
    }
}
