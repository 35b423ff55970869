package com.flagship.bounty_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bounty_ledger.collaborator.BudgetAdvice;
import lombok.Value;

import java.util.List;

@Value
public class BudgetAnalysisResponse {

    @JsonProperty("recommendation")
    String recommendation;

    @JsonProperty("suggested_actions")
    List<String> suggestedActions;

    @JsonProperty("health_score")
    int healthScore;

    public static BudgetAnalysisResponse from(BudgetAdvice advice) {
        return new BudgetAnalysisResponse(advice.getRecommendation(), advice.getSuggestedActions(),
                advice.getHealthScore());
    }
}
