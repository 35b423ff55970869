package com.flagship.bounty_ledger.payment;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.bounty_ledger.BountyFixtures;
import com.flagship.bounty_ledger.IntegrationTestSupport;
import com.flagship.bounty_ledger.collaborator.Confirmation;
import com.flagship.bounty_ledger.collaborator.TransferResult;
import com.flagship.bounty_ledger.security.AdminApiKeyFilter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

import java.math.BigDecimal;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * The whole bounty cycle over HTTP: register, publish, claim, submit, verify, settle.
 */
class PaymentControllerTest extends IntegrationTestSupport {

    private static final String ADMIN_KEY = "test-admin-key";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    @DisplayName("Approved submission is paid and the worker's totals reflect it")
    void fullCycle_ApprovedAndSettled() throws Exception {
        String workerId = read(mockMvc.perform(post("/api/users")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"username": "%s", "password": "hunter22", "wallet_address": "%s"}
                    """.formatted("flow-" + shortId(), BountyFixtures.WORKER_WALLET)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.wallet_address").value(BountyFixtures.WORKER_WALLET))
            .andExpect(jsonPath("$.password_hash").doesNotExist())).get("id").asText();

        String taskId = read(mockMvc.perform(admin(post("/api/tasks"))
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"title": "Star the repo", "description": "Star our GitHub repository",
                     "task_type": "code", "reward": 0.05,
                     "verification_criteria": "Screenshot or link showing the star"}
                    """))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.status").value("open"))
            .andExpect(jsonPath("$.task_type").value("code"))
            .andExpect(jsonPath("$.max_submissions").value(1))).get("id").asText();

        mockMvc.perform(post("/api/tasks/{id}/claim", taskId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"worker_id\": \"" + workerId + "\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("in_progress"))
            .andExpect(jsonPath("$.assigned_to").value(workerId));

        String submissionId = read(mockMvc.perform(post("/api/submissions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"task_id": "%s", "worker_id": "%s", "proof_type": "url",
                     "proof_data": "https://github.com/example/repo/stargazers"}
                    """.formatted(taskId, workerId)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.status").value("pending"))).get("id").asText();

        when(approvalJudge.evaluate(any())).thenReturn(BountyFixtures.approved(92));
        String paymentId = read(mockMvc.perform(admin(post("/api/submissions/{id}/verify", submissionId)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.outcome").value("approved"))
            .andExpect(jsonPath("$.score").value(92))
            .andExpect(jsonPath("$.payment_id").exists())).get("payment_id").asText();

        mockMvc.perform(get("/api/tasks/{id}", taskId))
            .andExpect(jsonPath("$.status").value("completed"));

        when(fundsExecutor.transfer(anyString(), any())).thenReturn(TransferResult.succeeded("sig-flow"));
        when(confirmationChecker.confirm("sig-flow"))
                .thenReturn(new Confirmation(true, new BigDecimal("0.05"), "funder", BountyFixtures.WORKER_WALLET));
        mockMvc.perform(admin(post("/api/payments/{id}/process", paymentId)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.status").value("completed"))
            .andExpect(jsonPath("$.signature").value("sig-flow"));

        JsonNode worker = read(mockMvc.perform(get("/api/users/{id}", workerId)).andExpect(status().isOk()));
        assertEquals(0, new BigDecimal("0.05").compareTo(worker.get("total_earnings").decimalValue()));
        assertEquals(1, worker.get("tasks_completed").asInt());

        mockMvc.perform(get("/api/users/{id}/payments", workerId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].id").value(paymentId))
            .andExpect(jsonPath("$[0].status").value("completed"))
            .andExpect(jsonPath("$[0].transaction_signature").value("sig-flow"));
    }

    @Test
    @DisplayName("Unconfirmed transfer answers 502 with the failed payment")
    void process_NotConfirmed_BadGateway() throws Exception {
        Payment payment = fixtures.pendingPayment(approvalJudge, "0.05");
        when(fundsExecutor.transfer(anyString(), any())).thenReturn(TransferResult.succeeded("sig-lost"));
        when(confirmationChecker.confirm("sig-lost")).thenReturn(Confirmation.notConfirmed());

        mockMvc.perform(admin(post("/api/payments/{id}/process", payment.getId())))
            .andExpect(status().isBadGateway())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.status").value("failed"))
            .andExpect(jsonPath("$.signature").value("sig-lost"))
            .andExpect(jsonPath("$.error").value("Transaction not confirmed"));

        mockMvc.perform(admin(post("/api/payments/{id}/process", payment.getId())))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("Conflict"));
    }

    @Test
    @DisplayName("Payment over the transfer cap answers 422 without touching the executor")
    void process_OverCap_Unprocessable() throws Exception {
        Payment payment = fixtures.pendingPayment(approvalJudge, "1.5");

        mockMvc.perform(admin(post("/api/payments/{id}/process", payment.getId())))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.status").value("failed"))
            .andExpect(jsonPath("$.error").value("Payment amount exceeds maximum (1 SOL)"));
    }

    @Test
    @DisplayName("Pending list and lookups use the snake_case payment shape")
    void listPending_ContainsNewPayment() throws Exception {
        Payment payment = fixtures.pendingPayment(approvalJudge, "0.05");

        mockMvc.perform(admin(get("/api/payments/{id}", payment.getId())))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.submission_id").value(payment.getSubmissionId().toString()))
            .andExpect(jsonPath("$.wallet_address").value(BountyFixtures.WORKER_WALLET))
            .andExpect(jsonPath("$.status").value("pending"));

        String body = mockMvc.perform(admin(get("/api/payments/pending")))
            .andExpect(status().isOk())
            .andReturn().getResponse().getContentAsString();
        assertTrue(body.contains(payment.getId().toString()));

        mockMvc.perform(admin(get("/api/payments/{id}", UUID.randomUUID())))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("Not Found"));
    }

    @Test
    @DisplayName("Process-all reports counts for the batch")
    void processAll_ReportsCounts() throws Exception {
        fixtures.pendingPayment(approvalJudge, "0.05");
        when(fundsExecutor.transfer(anyString(), any())).thenReturn(TransferResult.failed("Signer offline"));

        JsonNode response = read(mockMvc.perform(admin(post("/api/payments/process-all")))
            .andExpect(status().isOk()));

        assertTrue(response.get("processed").asInt() >= 1);
        assertEquals(response.get("processed").asInt(),
                response.get("completed").asInt() + response.get("failed").asInt());
        assertEquals(response.get("processed").asInt(), response.get("results").size());
    }

    @Test
    @DisplayName("Signature lookup is public and passes the network's answer through")
    void verifySignature_Public() throws Exception {
        when(confirmationChecker.confirm("sig-public"))
                .thenReturn(new Confirmation(true, new BigDecimal("0.2"), "from-addr", "to-addr"));

        mockMvc.perform(get("/api/payments/verify/{signature}", "sig-public"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.confirmed").value(true))
            .andExpect(jsonPath("$.from").value("from-addr"))
            .andExpect(jsonPath("$.to").value("to-addr"));
    }

    private MockHttpServletRequestBuilder admin(MockHttpServletRequestBuilder request) {
        return request.header(AdminApiKeyFilter.API_KEY_HEADER, ADMIN_KEY);
    }

    private JsonNode read(ResultActions result) throws Exception {
        return objectMapper.readTree(result.andReturn().getResponse().getContentAsString());
    }

    private static String shortId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
