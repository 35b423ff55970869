package com.flagship.bounty_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bounty_ledger.ledger.Budget;
import com.flagship.bounty_ledger.ledger.BudgetSnapshot;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class BudgetResponse {

    @JsonProperty("funding_address")
    String fundingAddress;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("total_paid_out")
    BigDecimal totalPaidOut;

    @JsonProperty("last_updated")
    Instant lastUpdated;

    @JsonProperty("live_balance")
    BigDecimal liveBalance;

    @JsonProperty("network")
    String network;

    public static BudgetResponse from(Budget budget) {
        return BudgetResponse.builder()
            .fundingAddress(budget.getFundingAddress())
            .balance(budget.getBalance())
            .totalPaidOut(budget.getTotalPaidOut())
            .lastUpdated(budget.getLastUpdated())
            .build();
    }

    public static BudgetResponse from(BudgetSnapshot snapshot) {
        Budget budget = snapshot.getBudget();
        String fundingAddress = snapshot.getFundingAddress() != null
                ? snapshot.getFundingAddress()
                : budget.getFundingAddress();
        return BudgetResponse.builder()
            .fundingAddress(fundingAddress)
            .balance(budget.getBalance())
            .totalPaidOut(budget.getTotalPaidOut())
            .lastUpdated(budget.getLastUpdated())
            .liveBalance(snapshot.getLiveBalance())
            .network(snapshot.getNetwork())
            .build();
    }
}
