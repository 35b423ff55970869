package com.flagship.bounty_ledger.collaborator.solana;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.bounty_ledger.collaborator.Collaborator;
import com.flagship.bounty_ledger.config.BountyProperties;
import com.flagship.bounty_ledger.exception.CollaboratorException;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;

/**
 * JSON-RPC transport to the settlement network.
 */
@Component
public class SolanaRpcClient {

    static final BigDecimal LAMPORTS_PER_SOL = new BigDecimal(1_000_000_000L);
    static final String COMMITMENT = "confirmed";

    private final RestClient restClient;

    public SolanaRpcClient(RestClient.Builder builder, BountyProperties properties) {
        BountyProperties.Settlement settlement = properties.getSettlement();

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) settlement.getConfirmTimeout().toMillis());
        requestFactory.setReadTimeout((int) settlement.getConfirmTimeout().toMillis());

        this.restClient = builder
                .baseUrl(settlement.getRpcUrl())
                .requestFactory(requestFactory)
                .build();
    }

    /**
     * Sends one JSON-RPC call and returns its {@code result}, which may be JSON null.
     *
     * @throws CollaboratorException on transport failure or an RPC error object
     */
    JsonNode call(Collaborator collaborator, String method, List<Object> params) {
        Map<String, Object> request = Map.of(
                "jsonrpc", "2.0",
                "id", 1,
                "method", method,
                "params", params);

        JsonNode response;
        try {
            response = restClient.post()
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new CollaboratorException(collaborator.getDisplayName(),
                    method + " failed: " + e.getMessage(), e);
        }

        if (response == null) {
            throw new CollaboratorException(collaborator.getDisplayName(), method + " returned no body");
        }
        if (response.has("error")) {
            throw new CollaboratorException(collaborator.getDisplayName(),
                    method + " error: " + response.path("error").path("message").asText("unknown"));
        }
        return response.get("result");
    }

    static BigDecimal toSol(BigDecimal lamports) {
        return lamports.divide(LAMPORTS_PER_SOL, 9, RoundingMode.UNNECESSARY);
    }
}
