package com.flagship.bounty_ledger.collaborator.anthropic;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.bounty_ledger.collaborator.Collaborator;
import com.flagship.bounty_ledger.collaborator.TaskDraft;
import com.flagship.bounty_ledger.collaborator.TaskGenerator;
import com.flagship.bounty_ledger.exception.CollaboratorException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Component
@RequiredArgsConstructor
public class AnthropicTaskGenerator implements TaskGenerator {

    private static final String NAME = Collaborator.TASK_GENERATOR.getDisplayName();
    private static final int MAX_TOKENS = 2048;

    private final AnthropicClient client;

    @Override
    public List<TaskDraft> generate(String projectContext, BigDecimal budget, int count) {
        String prompt = """
                You are an AI product manager for a crypto project. Generate %d tasks for human workers.

                Project Context: %s
                Available Budget: %s SOL

                Create diverse tasks that help promote and build the project. Mix of:
                - Social media tasks (tweets, threads)
                - Marketing tasks (showing logo IRL, community engagement)
                - Code tasks (github contributions)
                - Design tasks (memes, graphics)

                For each task, provide:
                - title: Short, clear task name
                - description: Detailed instructions
                - taskType: "code" | "social" | "marketing" | "design" | "other"
                - rewardSol: Amount in SOL (be fair, consider difficulty)
                - verificationCriteria: Specific requirements for approval

                Respond with a JSON array of tasks.""".formatted(count, projectContext, budget.toPlainString());

        JsonNode json = client.parseJson(NAME, client.complete(NAME, null, prompt, MAX_TOKENS));
        if (!json.isArray()) {
            throw new CollaboratorException(NAME, "Model response is not a task list");
        }

        List<TaskDraft> drafts = new ArrayList<>();
        for (JsonNode node : json) {
            drafts.add(new TaskDraft(
                    node.path("title").asText(null),
                    node.path("description").asText(null),
                    node.path("taskType").asText(null),
                    parseReward(node.path("rewardSol")),
                    node.path("verificationCriteria").asText(null)));
        }
        return drafts;
    }

    private static BigDecimal parseReward(JsonNode node) {
        if (node.isNumber()) {
            return node.decimalValue();
        }
        try {
            return node.isTextual() ? new BigDecimal(node.asText().trim()) : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
