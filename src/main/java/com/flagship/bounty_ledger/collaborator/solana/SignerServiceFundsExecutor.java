package com.flagship.bounty_ledger.collaborator.solana;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.bounty_ledger.collaborator.Collaborator;
import com.flagship.bounty_ledger.collaborator.FundsExecutor;
import com.flagship.bounty_ledger.collaborator.TransferResult;
import com.flagship.bounty_ledger.config.BountyProperties;
import com.flagship.bounty_ledger.exception.CollaboratorException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Funds executor backed by a signing service that holds the funding key.
 *
 * The service accepts {@code POST /transfer} with the destination and an amount in lamports, and
 * answers {@code {success, signature, error}}. This process never sees the private key.
 */
@Component
@Slf4j
public class SignerServiceFundsExecutor implements FundsExecutor {

    private final BountyProperties.Settlement settlement;
    private final RestClient restClient;

    public SignerServiceFundsExecutor(RestClient.Builder builder, BountyProperties properties) {
        this.settlement = properties.getSettlement();

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) settlement.getTransferTimeout().toMillis());
        requestFactory.setReadTimeout((int) settlement.getTransferTimeout().toMillis());

        RestClient.Builder configured = builder.requestFactory(requestFactory);
        if (settlement.isSignerConfigured()) {
            configured = configured.baseUrl(settlement.getSignerUrl());
        }
        this.restClient = configured.build();
    }

    @Override
    public TransferResult transfer(String destinationAddress, BigDecimal amount) {
        if (!settlement.isSignerConfigured()) {
            return TransferResult.failed("Funding wallet not configured");
        }

        long lamports = amount.multiply(SolanaRpcClient.LAMPORTS_PER_SOL).longValueExact();
        JsonNode response;
        try {
            response = restClient.post()
                    .uri("/transfer")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("destination", destinationAddress, "lamports", lamports))
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new CollaboratorException(Collaborator.FUNDS_EXECUTOR.getDisplayName(),
                    "Transfer request failed: " + e.getMessage(), e);
        }

        if (response == null) {
            throw new CollaboratorException(Collaborator.FUNDS_EXECUTOR.getDisplayName(), "Empty transfer response");
        }
        if (response.path("success").asBoolean(false) && response.hasNonNull("signature")) {
            log.info("Transfer of {} SOL to {} submitted: {}", amount.toPlainString(), destinationAddress,
                    response.get("signature").asText());
            return TransferResult.succeeded(response.get("signature").asText());
        }
        return TransferResult.failed(response.path("error").asText("Unknown payment error"));
    }
}
