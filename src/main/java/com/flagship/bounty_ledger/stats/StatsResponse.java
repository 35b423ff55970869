package com.flagship.bounty_ledger.stats;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class StatsResponse {

    @JsonProperty("tasks")
    TaskStats tasks;

    @JsonProperty("workers")
    WorkerStats workers;

    @Value
    public static class TaskStats {
        @JsonProperty("total")
        long total;

        @JsonProperty("open")
        long open;

        @JsonProperty("completed")
        long completed;

        @JsonProperty("total_rewards")
        BigDecimal totalRewards;
    }

    @Value
    public static class WorkerStats {
        @JsonProperty("total")
        long total;
    }
}
