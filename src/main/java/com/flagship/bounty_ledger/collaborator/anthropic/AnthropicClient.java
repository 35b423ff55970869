package com.flagship.bounty_ledger.collaborator.anthropic;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.bounty_ledger.config.BountyProperties;
import com.flagship.bounty_ledger.exception.CollaboratorException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Thin client for the Anthropic Messages API. Returns the first text block of the answer.
 */
@Component
@Slf4j
public class AnthropicClient {

    static final String API_VERSION = "2023-06-01";
    private static final Pattern FENCED_JSON = Pattern.compile("```(?:json)?\\s*([\\s\\S]*?)```");

    private final BountyProperties.Judge judge;
    private final ObjectMapper objectMapper;
    private final RestClient restClient;

    public AnthropicClient(RestClient.Builder builder, BountyProperties properties, ObjectMapper objectMapper) {
        this.judge = properties.getJudge();
        this.objectMapper = objectMapper;

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) judge.getTimeout().toMillis());
        requestFactory.setReadTimeout((int) judge.getTimeout().toMillis());

        this.restClient = builder
                .baseUrl(judge.getBaseUrl())
                .requestFactory(requestFactory)
                .defaultHeader("anthropic-version", API_VERSION)
                .build();
    }

    /**
     * Sends one user turn and returns the text of the reply.
     *
     * @param collaborator name used in error reports
     * @param system       optional system prompt
     * @param content      a plain string or a list of content blocks
     */
    public String complete(String collaborator, String system, Object content, int maxTokens) {
        if (!judge.isConfigured()) {
            throw new CollaboratorException(collaborator, "ANTHROPIC_API_KEY is not configured");
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", judge.getModel());
        body.put("max_tokens", maxTokens);
        if (system != null) {
            body.put("system", system);
        }
        body.put("messages", List.of(Map.of("role", "user", "content", content)));

        JsonNode response;
        try {
            response = restClient.post()
                    .uri("/v1/messages")
                    .contentType(MediaType.APPLICATION_JSON)
                    .header("x-api-key", judge.getApiKey())
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new CollaboratorException(collaborator, "Anthropic API call failed: " + e.getMessage(), e);
        }

        if (response != null) {
            for (JsonNode block : response.path("content")) {
                if ("text".equals(block.path("type").asText())) {
                    return block.path("text").asText();
                }
            }
        }
        throw new CollaboratorException(collaborator, "No text response from model");
    }

    /**
     * Parses the JSON in a model reply, tolerating a surrounding markdown code fence.
     */
    public JsonNode parseJson(String collaborator, String text) {
        String json = extractJson(text);
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("{} returned unparseable output: {}", collaborator, e.getOriginalMessage());
            throw new CollaboratorException(collaborator, "Unparseable model response: " + e.getOriginalMessage(), e);
        }
    }

    static String extractJson(String text) {
        Matcher matcher = FENCED_JSON.matcher(text);
        if (matcher.find()) {
            return matcher.group(1).trim();
        }
        return text.trim();
    }
}
