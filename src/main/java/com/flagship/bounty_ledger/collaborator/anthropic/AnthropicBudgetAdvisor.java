package com.flagship.bounty_ledger.collaborator.anthropic;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.bounty_ledger.collaborator.BudgetAdvice;
import com.flagship.bounty_ledger.collaborator.BudgetAdvisor;
import com.flagship.bounty_ledger.collaborator.Collaborator;
import com.flagship.bounty_ledger.exception.CollaboratorException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Component
@RequiredArgsConstructor
public class AnthropicBudgetAdvisor implements BudgetAdvisor {

    private static final String NAME = Collaborator.BUDGET_ADVISOR.getDisplayName();
    private static final int MAX_TOKENS = 512;

    private final AnthropicClient client;

    @Override
    public BudgetAdvice advise(BigDecimal balance, BigDecimal pendingPayments, long completedTasks) {
        String prompt = """
                As an AI Finance Manager, analyze this budget situation:

                Current Balance: %s SOL
                Pending Payments: %s SOL
                Completed Tasks: %d

                Provide:
                1. A brief recommendation
                2. Suggested actions (as array)
                3. Health score (0-100)

                Respond with JSON: { "recommendation": "...", "suggestedActions": [...], "healthScore": number }"""
                .formatted(balance.toPlainString(), pendingPayments.toPlainString(), completedTasks);

        JsonNode json = client.parseJson(NAME, client.complete(NAME, null, prompt, MAX_TOKENS));
        if (!json.isObject() || !json.path("recommendation").isTextual()) {
            throw new CollaboratorException(NAME, "Model response has no recommendation");
        }

        List<String> actions = new ArrayList<>();
        json.path("suggestedActions").forEach(node -> actions.add(node.asText()));

        return BudgetAdvice.of(json.path("recommendation").asText(), actions, json.path("healthScore").asDouble(0));
    }
}
