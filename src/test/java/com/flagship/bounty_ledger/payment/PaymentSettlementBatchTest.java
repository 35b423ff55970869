package com.flagship.bounty_ledger.payment;

import com.flagship.bounty_ledger.collaborator.BoundedCaller;
import com.flagship.bounty_ledger.collaborator.Confirmation;
import com.flagship.bounty_ledger.collaborator.ConfirmationChecker;
import com.flagship.bounty_ledger.collaborator.FundsExecutor;
import com.flagship.bounty_ledger.collaborator.TransferResult;
import com.flagship.bounty_ledger.collaborator.solana.PayoutAddressValidator;
import com.flagship.bounty_ledger.config.BountyProperties;
import com.flagship.bounty_ledger.observability.OrchestrationMetrics;
import com.flagship.bounty_ledger.payment.dto.SettleAllResponse;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Batch settlement when a payment aborts outside the known failure paths.
 */
@ExtendWith(MockitoExtension.class)
class PaymentSettlementBatchTest {

    private static final String WALLET = "So11111111111111111111111111111111111111112";

    @Mock
    private PaymentPersistenceService persistenceService;

    @Mock
    private SettlementCommitService commitService;

    @Mock
    private FundsExecutor fundsExecutor;

    @Mock
    private ConfirmationChecker confirmationChecker;

    private BoundedCaller boundedCaller;
    private PaymentSettlementService settlementService;

    @BeforeEach
    void setUp() {
        OrchestrationMetrics metrics = new OrchestrationMetrics(new SimpleMeterRegistry());
        boundedCaller = new BoundedCaller(metrics);
        settlementService = new PaymentSettlementService(persistenceService, commitService, fundsExecutor,
                confirmationChecker, new PayoutAddressValidator(), boundedCaller, metrics, new BountyProperties());
    }

    @AfterEach
    void tearDown() {
        boundedCaller.shutdown();
    }

    @Test
    @DisplayName("A commit failure after a confirmed transfer is reported as an error, not a conflict")
    void settleAll_CommitFails_ReportedAsErrorWithProcessingStatus() {
        Payment stuck = pending("0.1");
        Payment healthy = pending("0.2");
        when(persistenceService.findPending()).thenReturn(List.of(stuck, healthy));
        when(persistenceService.get(stuck.getId())).thenReturn(stuck, stuck.startProcessing());
        when(persistenceService.get(healthy.getId())).thenReturn(healthy);
        when(fundsExecutor.transfer(eq(WALLET), any()))
                .thenReturn(TransferResult.succeeded("sig-stuck"), TransferResult.succeeded("sig-ok"));
        when(confirmationChecker.confirm(anyString())).thenReturn(new Confirmation(true, null, null, null));
        when(commitService.commit(stuck.getId(), "sig-stuck"))
                .thenThrow(new DataAccessResourceFailureException("connection reset"));
        when(commitService.commit(healthy.getId(), "sig-ok"))
                .thenReturn(healthy.startProcessing().complete("sig-ok"));

        List<SettlementResult> results = settlementService.settleAll();

        assertEquals(2, results.size());
        SettlementResult aborted = results.get(0);
        assertEquals(stuck.getId(), aborted.getPaymentId());
        assertFalse(aborted.isSuccess());
        assertEquals(SettlementResult.Failure.ERROR, aborted.getFailure());
        assertEquals(PaymentStatus.PROCESSING, aborted.getStatus());
        assertTrue(aborted.getError().contains("connection reset"));

        assertTrue(results.get(1).isSuccess());
        verify(persistenceService, never()).markFailed(eq(stuck.getId()), anyString(), any());

        SettleAllResponse response = SettleAllResponse.from(results);
        assertEquals(1, response.getCompleted());
        assertEquals(SettlementResult.Failure.ERROR, response.getResults().get(0).getFailure());
    }

    private static Payment pending(String amount) {
        return Payment.create(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), WALLET, new BigDecimal(amount));
    }
}
