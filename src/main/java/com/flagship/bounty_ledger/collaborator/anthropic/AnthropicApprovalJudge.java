package com.flagship.bounty_ledger.collaborator.anthropic;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.bounty_ledger.collaborator.ApprovalJudge;
import com.flagship.bounty_ledger.collaborator.Collaborator;
import com.flagship.bounty_ledger.collaborator.JudgeRequest;
import com.flagship.bounty_ledger.collaborator.JudgeVerdict;
import com.flagship.bounty_ledger.config.BountyProperties;
import com.flagship.bounty_ledger.exception.CollaboratorException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Judge backed by a multimodal model. Image proofs are sent as base64 image blocks, URL and text
 * proofs as prose.
 */
@Component
@RequiredArgsConstructor
public class AnthropicApprovalJudge implements ApprovalJudge {

    private static final String NAME = Collaborator.APPROVAL_JUDGE.getDisplayName();
    private static final Pattern DATA_URL = Pattern.compile("^data:(image/[\\w.+-]+);base64,");

    private final AnthropicClient client;
    private final BountyProperties properties;

    @Override
    public JudgeVerdict evaluate(JudgeRequest request) {
        String text = client.complete(NAME, systemPrompt(request), userContent(request),
                properties.getJudge().getMaxTokens());
        JsonNode json = client.parseJson(NAME, text);

        if (!json.isObject() || !json.has("approved")) {
            throw new CollaboratorException(NAME, "Model response has no verdict");
        }

        List<String> suggestions = new ArrayList<>();
        json.path("suggestions").forEach(node -> suggestions.add(node.asText()));

        return JudgeVerdict.of(
                json.path("approved").asBoolean(false) && json.path("approved").isBoolean(),
                json.path("score").asDouble(0),
                json.path("reasoning").asText(null),
                suggestions);
    }

    private String systemPrompt(JudgeRequest request) {
        return """
                You are an AI employer evaluating task submissions. Your role is to:
                1. Carefully examine the proof provided by the worker
                2. Compare it against the task requirements and verification criteria
                3. Determine if the work meets the standards for payment

                Be fair but strict. Workers deserve to be paid for legitimate work, but low-quality \
                submissions should be rejected.

                Task Details:
                - Title: %s
                - Description: %s
                - Type: %s
                - Reward: %s SOL
                - Verification Criteria: %s

                Respond with a JSON object containing:
                {
                  "approved": boolean,
                  "score": number (0-100),
                  "reasoning": "detailed explanation of your decision",
                  "suggestions": ["optional improvement suggestions if rejected"]
                }""".formatted(
                request.getTaskTitle(),
                request.getTaskDescription(),
                request.getTaskType(),
                request.getReward().toPlainString(),
                request.getVerificationCriteria());
    }

    private Object userContent(JudgeRequest request) {
        String description = request.getProofDescription() != null && !request.getProofDescription().isBlank()
                ? request.getProofDescription()
                : "No description provided";

        switch (request.getProofType()) {
            case "image": {
                Matcher matcher = DATA_URL.matcher(request.getProofData());
                String mediaType = matcher.find() ? matcher.group(1) : "image/jpeg";
                String data = DATA_URL.matcher(request.getProofData()).replaceFirst("");
                return List.of(
                        Map.of("type", "text",
                                "text", "Please verify this task submission.\n\nProof Description: "
                                        + description + "\n\nAnalyze the image proof below:"),
                        Map.of("type", "image",
                                "source", Map.of("type", "base64", "media_type", mediaType, "data", data)));
            }
            case "url":
                return """
                        Please verify this task submission.

                        Proof Type: URL
                        Proof URL: %s
                        Proof Description: %s

                        Analyze if this URL proof satisfies the task requirements. Consider:
                        - Does the URL point to valid content?
                        - Does the content match the task description?
                        - Is the work quality acceptable?""".formatted(request.getProofData(), description);
            default:
                return """
                        Please verify this task submission.

                        Proof Type: Text
                        Proof Content:
                        ---
                        %s
                        ---

                        Proof Description: %s

                        Analyze if this text proof satisfies the task requirements.""".formatted(
                        request.getProofData(), description);
        }
    }
}
