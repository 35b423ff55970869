package com.flagship.bounty_ledger.payment;

import com.flagship.bounty_ledger.collaborator.BoundedCaller;
import com.flagship.bounty_ledger.collaborator.Collaborator;
import com.flagship.bounty_ledger.collaborator.Confirmation;
import com.flagship.bounty_ledger.collaborator.ConfirmationChecker;
import com.flagship.bounty_ledger.collaborator.FundsExecutor;
import com.flagship.bounty_ledger.collaborator.TransferResult;
import com.flagship.bounty_ledger.collaborator.solana.PayoutAddressValidator;
import com.flagship.bounty_ledger.config.BountyProperties;
import com.flagship.bounty_ledger.exception.CollaboratorException;
import com.flagship.bounty_ledger.exception.ConflictException;
import com.flagship.bounty_ledger.observability.CorrelationContext;
import com.flagship.bounty_ledger.observability.OrchestrationMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Drives a payment from PENDING to COMPLETED or FAILED.
 *
 * Not transactional itself: every step commits before the next external call.
 * <ol>
 *   <li>validate amount and address; a refusal marks the payment FAILED with no external call</li>
 *   <li>PENDING → PROCESSING (the commitment point)</li>
 *   <li>transfer through the funds executor</li>
 *   <li>confirm the signature; unconfirmed means FAILED even with a signature</li>
 *   <li>one commit: COMPLETED, ledger accrual, worker earnings</li>
 * </ol>
 * Every external call is time-bounded and a timeout fails the payment, so nothing stays in
 * PROCESSING because a collaborator hung. Failed payments are not retried.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentSettlementService {

    static final String NOT_CONFIRMED = "Transaction not confirmed";

    private final PaymentPersistenceService persistenceService;
    private final SettlementCommitService commitService;
    private final FundsExecutor fundsExecutor;
    private final ConfirmationChecker confirmationChecker;
    private final PayoutAddressValidator addressValidator;
    private final BoundedCaller boundedCaller;
    private final OrchestrationMetrics metrics;
    private final BountyProperties properties;

    /**
     * Settles one pending payment.
     *
     * @throws com.flagship.bounty_ledger.exception.NotFoundException if the payment does not exist
     * @throws ConflictException if it is not pending
     */
    public SettlementResult settle(UUID paymentId) {
        MDC.put(CorrelationContext.PAYMENT_ID_MDC_KEY, paymentId.toString());
        try {
            SettlementResult result = doSettle(paymentId);
            metrics.recordSettlement(result.isSuccess() ? "completed" : result.getFailure().name());
            return result;
        } finally {
            MDC.remove(CorrelationContext.PAYMENT_ID_MDC_KEY);
        }
    }

    /**
     * Settles every pending payment, oldest first, one at a time. A failure on one payment never
     * stops the rest.
     */
    public List<SettlementResult> settleAll() {
        List<Payment> pending = persistenceService.findPending();
        log.info("Settling {} pending payments", pending.size());

        List<SettlementResult> results = new ArrayList<>();
        for (Payment payment : pending) {
            try {
                results.add(settle(payment.getId()));
            } catch (ConflictException e) {
                results.add(SettlementResult.conflict(payment.getId(),
                        persistenceService.get(payment.getId()).getStatus(), e.getMessage()));
            } catch (RuntimeException e) {
                log.error("Settlement of payment {} aborted", payment.getId(), e);
                results.add(SettlementResult.error(payment.getId(),
                        persistenceService.get(payment.getId()).getStatus(), e.getMessage()));
            }
        }
        return results;
    }

    /**
     * Passthrough lookup of any signature on the settlement network.
     */
    public Confirmation confirmSignature(String signature) {
        if (signature == null || signature.isBlank()) {
            throw new IllegalArgumentException("Signature is required");
        }
        Confirmation confirmation = boundedCaller.call(Collaborator.CONFIRMATION_CHECKER,
                properties.getSettlement().getConfirmTimeout(),
                () -> confirmationChecker.confirm(signature.trim()));
        return confirmation != null ? confirmation : Confirmation.notConfirmed();
    }

    private SettlementResult doSettle(UUID paymentId) {
        Payment payment = persistenceService.get(paymentId);
        if (!payment.isPending()) {
            throw new ConflictException(
                "Payment " + paymentId + " is " + payment.getStatus().name().toLowerCase() + ", not pending");
        }

        SettlementResult refused = validate(payment);
        if (refused != null) {
            return refused;
        }

        persistenceService.markProcessing(paymentId);
        log.info("Payment {} processing: {} to {}", paymentId, payment.getAmount().toPlainString(),
                payment.getWalletAddress());

        TransferResult transfer;
        try {
            transfer = boundedCaller.call(Collaborator.FUNDS_EXECUTOR,
                    properties.getSettlement().getTransferTimeout(),
                    () -> fundsExecutor.transfer(payment.getWalletAddress(), payment.getAmount()));
        } catch (CollaboratorException e) {
            return SettlementResult.failed(
                    persistenceService.markFailed(paymentId, e.getMessage(), null), SettlementResult.Failure.TRANSFER);
        }
        if (transfer == null || !transfer.isSuccess() || transfer.getSignature() == null) {
            String error = transfer != null && transfer.getError() != null ? transfer.getError() : "Transfer failed";
            return SettlementResult.failed(
                    persistenceService.markFailed(paymentId, error, null), SettlementResult.Failure.TRANSFER);
        }

        String signature = transfer.getSignature();
        Confirmation confirmation;
        try {
            confirmation = boundedCaller.call(Collaborator.CONFIRMATION_CHECKER,
                    properties.getSettlement().getConfirmTimeout(),
                    () -> confirmationChecker.confirm(signature));
        } catch (CollaboratorException e) {
            return SettlementResult.failed(
                    persistenceService.markFailed(paymentId, NOT_CONFIRMED + ": " + e.getMessage(), signature),
                    SettlementResult.Failure.NOT_CONFIRMED);
        }
        if (confirmation == null || !confirmation.isConfirmed()) {
            return SettlementResult.failed(
                    persistenceService.markFailed(paymentId, NOT_CONFIRMED, signature),
                    SettlementResult.Failure.NOT_CONFIRMED);
        }

        return SettlementResult.completed(commitService.commit(paymentId, signature));
    }

    private SettlementResult validate(Payment payment) {
        BigDecimal amount = payment.getAmount();
        BigDecimal maxPayment = properties.getLimits().getMaxPayment();

        if (amount == null || amount.signum() <= 0) {
            return SettlementResult.failed(
                    persistenceService.markFailed(payment.getId(), "Invalid payment amount", null),
                    SettlementResult.Failure.VALIDATION);
        }
        if (amount.compareTo(maxPayment) > 0) {
            return SettlementResult.failed(
                    persistenceService.markFailed(payment.getId(),
                            "Payment amount exceeds maximum (" + maxPayment.toPlainString() + " SOL)", null),
                    SettlementResult.Failure.LIMIT_EXCEEDED);
        }
        if (!addressValidator.isValid(payment.getWalletAddress())) {
            return SettlementResult.failed(
                    persistenceService.markFailed(payment.getId(), "Invalid wallet address", null),
                    SettlementResult.Failure.VALIDATION);
        }
        return null;
    }
}
