package com.flagship.bounty_ledger.payment;

import com.flagship.bounty_ledger.payment.dto.ConfirmationResponse;
import com.flagship.bounty_ledger.payment.dto.PaymentResponse;
import com.flagship.bounty_ledger.payment.dto.SettleAllResponse;
import com.flagship.bounty_ledger.payment.dto.SettlementResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Payment listing and settlement. Everything except signature verification is admin-only.
 *
 * A settlement that ends FAILED is answered with its result body and a status naming the cause:
 * 400 for a refused amount or address, 422 over the payment cap, 502 when the transfer or its
 * confirmation failed.
 */
@RestController
@RequestMapping("/api/payments")
@RequiredArgsConstructor
@Slf4j
public class PaymentController {

    private final PaymentService paymentService;
    private final PaymentSettlementService settlementService;

    @GetMapping
    public List<PaymentResponse> listPayments() {
        return paymentService.listPayments().stream().map(PaymentResponse::from).toList();
    }

    @GetMapping("/pending")
    public List<PaymentResponse> listPending() {
        return paymentService.listPending().stream().map(PaymentResponse::from).toList();
    }

    @GetMapping("/{id}")
    public PaymentResponse getPayment(@PathVariable("id") UUID id) {
        return PaymentResponse.from(paymentService.getPayment(id));
    }

    @PostMapping("/{id}/process")
    public ResponseEntity<SettlementResponse> settle(@PathVariable("id") UUID id) {
        SettlementResult result = settlementService.settle(id);
        return ResponseEntity.status(statusFor(result)).body(SettlementResponse.from(result));
    }

    @PostMapping("/process-all")
    public SettleAllResponse settleAll() {
        SettleAllResponse response = SettleAllResponse.from(settlementService.settleAll());
        log.info("Settled pending payments: processed={}, completed={}, failed={}",
                response.getProcessed(), response.getCompleted(), response.getFailed());
        return response;
    }

    @GetMapping("/verify/{signature}")
    public ConfirmationResponse verifySignature(@PathVariable("signature") String signature) {
        return ConfirmationResponse.from(signature, settlementService.confirmSignature(signature));
    }

    private static HttpStatus statusFor(SettlementResult result) {
        if (result.isSuccess()) {
            return HttpStatus.OK;
        }
        return switch (result.getFailure()) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case LIMIT_EXCEEDED -> HttpStatus.UNPROCESSABLE_ENTITY;
            case CONFLICT -> HttpStatus.CONFLICT;
            case TRANSFER, NOT_CONFIRMED -> HttpStatus.BAD_GATEWAY;
            case ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
