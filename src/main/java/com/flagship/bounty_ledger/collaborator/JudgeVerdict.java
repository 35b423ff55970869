package com.flagship.bounty_ledger.collaborator;

import lombok.Value;

import java.util.List;

/**
 * A genuine verdict. The score is clamped to 0-100 on construction.
 */
@Value
public class JudgeVerdict {
    boolean approved;
    int score;
    String reasoning;
    List<String> suggestions;

    public static JudgeVerdict of(boolean approved, double rawScore, String reasoning, List<String> suggestions) {
        return new JudgeVerdict(approved, clampScore(rawScore),
                reasoning == null || reasoning.isBlank() ? "No reasoning provided" : reasoning,
                suggestions == null ? List.of() : List.copyOf(suggestions));
    }

    public static int clampScore(double rawScore) {
        if (Double.isNaN(rawScore)) {
            return 0;
        }
        return (int) Math.round(Math.max(0, Math.min(100, rawScore)));
    }
}
