package com.flagship.bounty_ledger.collaborator;

import lombok.Value;

import java.util.List;

/**
 * An advisor's reading of the budget. The health score is clamped to 0-100 on construction.
 */
@Value
public class BudgetAdvice {
    String recommendation;
    List<String> suggestedActions;
    int healthScore;

    public static BudgetAdvice of(String recommendation, List<String> suggestedActions, double rawHealthScore) {
        return new BudgetAdvice(recommendation,
                suggestedActions == null ? List.of() : List.copyOf(suggestedActions),
                JudgeVerdict.clampScore(rawHealthScore));
    }
}
