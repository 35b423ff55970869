package com.flagship.bounty_ledger.collaborator.solana;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.bounty_ledger.collaborator.Collaborator;
import com.flagship.bounty_ledger.collaborator.Confirmation;
import com.flagship.bounty_ledger.collaborator.ConfirmationChecker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
@Slf4j
public class SolanaConfirmationChecker implements ConfirmationChecker {

    private final SolanaRpcClient rpcClient;

    /**
     * A transaction is confirmed when the network knows it and it executed without error.
     * For a plain transfer the moved amount is the recipient's balance delta, which excludes the fee.
     */
    @Override
    public Confirmation confirm(String signature) {
        JsonNode result = rpcClient.call(Collaborator.CONFIRMATION_CHECKER, "getTransaction", List.of(
                signature,
                Map.of("commitment", SolanaRpcClient.COMMITMENT, "maxSupportedTransactionVersion", 0)));

        if (result == null || result.isNull() || result.isMissingNode()) {
            return Confirmation.notConfirmed();
        }
        JsonNode meta = result.path("meta");
        if (!meta.path("err").isNull() && !meta.path("err").isMissingNode()) {
            log.info("Transaction {} landed with error: {}", signature, meta.path("err"));
            return Confirmation.notConfirmed();
        }

        JsonNode pre = meta.path("preBalances");
        JsonNode post = meta.path("postBalances");
        JsonNode accountKeys = result.path("transaction").path("message").path("accountKeys");
        if (pre.size() >= 2 && post.size() >= 2 && accountKeys.size() >= 2) {
            BigDecimal lamports = BigDecimal.valueOf(post.get(1).asLong() - pre.get(1).asLong()).abs();
            return new Confirmation(true, SolanaRpcClient.toSol(lamports),
                    accountKeys.get(0).asText(), accountKeys.get(1).asText());
        }
        return new Confirmation(true, null, null, null);
    }
}
