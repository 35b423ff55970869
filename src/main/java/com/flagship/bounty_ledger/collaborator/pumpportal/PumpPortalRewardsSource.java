package com.flagship.bounty_ledger.collaborator.pumpportal;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.bounty_ledger.collaborator.Collaborator;
import com.flagship.bounty_ledger.collaborator.CreatorRewards;
import com.flagship.bounty_ledger.collaborator.RewardsClaim;
import com.flagship.bounty_ledger.collaborator.RewardsSource;
import com.flagship.bounty_ledger.config.BountyProperties;
import com.flagship.bounty_ledger.exception.CollaboratorException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * Creator-fee rewards from the PumpPortal HTTP API.
 */
@Component
@Slf4j
public class PumpPortalRewardsSource implements RewardsSource {

    private static final String NAME = Collaborator.REWARDS_SOURCE.getDisplayName();

    private final RestClient restClient;

    public PumpPortalRewardsSource(RestClient.Builder builder, BountyProperties properties) {
        BountyProperties.Rewards rewards = properties.getRewards();

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) rewards.getTimeout().toMillis());
        requestFactory.setReadTimeout((int) rewards.getTimeout().toMillis());

        this.restClient = builder
                .baseUrl(rewards.getBaseUrl())
                .requestFactory(requestFactory)
                .build();
    }

    @Override
    public CreatorRewards query(String address) {
        JsonNode body;
        try {
            body = restClient.get()
                    .uri("/creator-rewards/{address}", address)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new CollaboratorException(NAME, "Rewards lookup failed: " + e.getMessage(), e);
        }
        if (body == null) {
            throw new CollaboratorException(NAME, "Rewards lookup returned no body");
        }
        return new CreatorRewards(address, decimal(body.path("balance")), decimal(body.path("claimable")),
                Instant.now());
    }

    /**
     * A non-2xx answer is a declined claim; a transport failure is a collaborator error.
     */
    @Override
    public RewardsClaim claim(String address) {
        JsonNode body;
        try {
            body = restClient.post()
                    .uri("/creator-rewards/claim")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("walletAddress", address))
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientResponseException e) {
            log.warn("Rewards claim for {} declined: {}", address, e.getStatusCode());
            return RewardsClaim.failed("Failed to claim rewards: " + e.getStatusCode().value());
        } catch (RestClientException e) {
            throw new CollaboratorException(NAME, "Rewards claim failed: " + e.getMessage(), e);
        }
        if (body == null) {
            return RewardsClaim.failed("Empty claim response");
        }
        return new RewardsClaim(true, body.path("signature").asText(null), decimal(body.path("amount")), null);
    }

    private static BigDecimal decimal(JsonNode node) {
        return node.isNumber() ? node.decimalValue() : BigDecimal.ZERO;
    }
}
