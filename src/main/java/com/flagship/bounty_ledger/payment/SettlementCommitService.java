package com.flagship.bounty_ledger.payment;

import com.flagship.bounty_ledger.exception.NotFoundException;
import com.flagship.bounty_ledger.ledger.LedgerService;
import com.flagship.bounty_ledger.outbox.OutboxService;
import com.flagship.bounty_ledger.payment.event.PaymentSettledEvent;
import com.flagship.bounty_ledger.user.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * The final commit of a confirmed settlement.
 *
 * Payment COMPLETED, the ledger accrual and the worker's earnings commit together or not at all.
 * The payment id is the idempotency key: a repeated commit for an already completed payment
 * changes nothing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SettlementCommitService {

    private final PaymentRepository paymentRepository;
    private final LedgerService ledgerService;
    private final UserService userService;
    private final OutboxService outboxService;

    @Transactional
    public Payment commit(UUID paymentId, String signature) {
        PaymentEntity entity = paymentRepository.findById(paymentId)
                .orElseThrow(() -> NotFoundException.of("Payment", paymentId));

        if (entity.getStatus() == PaymentStatus.COMPLETED) {
            log.info("Payment {} already completed, nothing to commit", paymentId);
            return entity.toDomain();
        }

        Payment completed = entity.toDomain().complete(signature);
        entity.updateFromDomain(completed);
        paymentRepository.saveAndFlush(entity);

        if (ledgerService.accrue(paymentId, completed.getWorkerId(), completed.getAmount())) {
            userService.recordEarning(completed.getWorkerId(), completed.getAmount());
        }
        outboxService.saveEvent(PaymentSettledEvent.fromPayment(completed));

        log.info("Payment {} settled: amount={}, signature={}", paymentId,
                completed.getAmount().toPlainString(), signature);
        return completed;
    }
}
