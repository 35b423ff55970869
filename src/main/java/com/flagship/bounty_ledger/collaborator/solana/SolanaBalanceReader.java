package com.flagship.bounty_ledger.collaborator.solana;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.bounty_ledger.collaborator.BalanceReader;
import com.flagship.bounty_ledger.collaborator.Collaborator;
import com.flagship.bounty_ledger.exception.CollaboratorException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class SolanaBalanceReader implements BalanceReader {

    private final SolanaRpcClient rpcClient;

    @Override
    public BigDecimal balanceOf(String address) {
        JsonNode result = rpcClient.call(Collaborator.BALANCE_READER, "getBalance",
                List.of(address, Map.of("commitment", SolanaRpcClient.COMMITMENT)));
        if (result == null || !result.path("value").canConvertToLong()) {
            throw new CollaboratorException(Collaborator.BALANCE_READER.getDisplayName(),
                    "Balance response has no value");
        }
        return SolanaRpcClient.toSol(BigDecimal.valueOf(result.path("value").asLong()));
    }
}
