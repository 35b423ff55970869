package com.flagship.bounty_ledger.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.bounty_ledger.IntegrationTestSupport;
import com.flagship.bounty_ledger.collaborator.BudgetAdvice;
import com.flagship.bounty_ledger.collaborator.CreatorRewards;
import com.flagship.bounty_ledger.collaborator.RewardsClaim;
import com.flagship.bounty_ledger.exception.CollaboratorException;
import com.flagship.bounty_ledger.payment.PaymentRepository;
import com.flagship.bounty_ledger.payment.PaymentStatus;
import com.flagship.bounty_ledger.security.AdminApiKeyFilter;
import com.flagship.bounty_ledger.task.TaskRepository;
import com.flagship.bounty_ledger.task.TaskStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class BudgetControllerTest extends IntegrationTestSupport {

    private static final String ADMIN_KEY = "test-admin-key";
    private static final String FUNDING = "So11111111111111111111111111111111111111112";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private PaymentRepository paymentRepository;

    @Autowired
    private TaskRepository taskRepository;

    @Test
    @DisplayName("Refresh overwrites the recorded balance with the network balance")
    void refresh_RecordsNetworkBalance() throws Exception {
        when(balanceReader.balanceOf(FUNDING)).thenReturn(new BigDecimal("4.2"));

        mockMvc.perform(post("/api/budget/refresh").header(AdminApiKeyFilter.API_KEY_HEADER, ADMIN_KEY))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.funding_address").value(FUNDING));

        assertEquals(0, new BigDecimal("4.2").compareTo(ledgerService.getBudget().getBalance()));
    }

    @Test
    @DisplayName("Budget read survives an unreachable network and omits the live balance")
    void getBudget_NetworkDown_LiveBalanceOmitted() throws Exception {
        when(balanceReader.balanceOf(anyString()))
                .thenThrow(new CollaboratorException("Balance reader", "rpc down"));

        mockMvc.perform(get("/api/budget").header(AdminApiKeyFilter.API_KEY_HEADER, ADMIN_KEY))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_paid_out").exists())
            .andExpect(jsonPath("$.live_balance").doesNotExist())
            .andExpect(jsonPath("$.network").value("devnet"));
    }

    @Test
    @DisplayName("Creator rewards default to the funding address")
    void creatorRewards_DefaultAddress() throws Exception {
        when(rewardsSource.query(FUNDING)).thenReturn(
                new CreatorRewards(FUNDING, new BigDecimal("0.8"), new BigDecimal("0.5"), Instant.now()));

        mockMvc.perform(get("/api/budget/creator-rewards").header(AdminApiKeyFilter.API_KEY_HEADER, ADMIN_KEY))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.wallet_address").value(FUNDING))
            .andExpect(jsonPath("$.claimable").value(0.5));

        mockMvc.perform(get("/api/budget/creator-rewards")
                .param("wallet_address", "bad address")
                .header(AdminApiKeyFilter.API_KEY_HEADER, ADMIN_KEY))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Successful claim credits the balance; a failed claim answers 502 and credits nothing")
    void claimRewards() throws Exception {
        when(balanceReader.balanceOf(FUNDING)).thenReturn(new BigDecimal("1"));
        mockMvc.perform(post("/api/budget/refresh").header(AdminApiKeyFilter.API_KEY_HEADER, ADMIN_KEY))
            .andExpect(status().isOk());

        when(rewardsSource.claim(FUNDING)).thenReturn(new RewardsClaim(true, "claim-sig", new BigDecimal("0.25"), null));
        JsonNode claimed = objectMapper.readTree(mockMvc.perform(post("/api/budget/claim-rewards")
                .header(AdminApiKeyFilter.API_KEY_HEADER, ADMIN_KEY))
            .andExpect(status().isOk())
            .andReturn().getResponse().getContentAsString());
        assertTrue(claimed.get("success").asBoolean());
        assertEquals(0, new BigDecimal("1.25").compareTo(ledgerService.getBudget().getBalance()));

        when(rewardsSource.claim(FUNDING)).thenReturn(RewardsClaim.failed("Nothing to claim"));
        mockMvc.perform(post("/api/budget/claim-rewards")
                .header(AdminApiKeyFilter.API_KEY_HEADER, ADMIN_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"wallet_address\": \"" + FUNDING + "\"}"))
            .andExpect(status().isBadGateway())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.error").value("Nothing to claim"));
        assertEquals(0, new BigDecimal("1.25").compareTo(ledgerService.getBudget().getBalance()));
        verify(rewardsSource, times(2)).claim(FUNDING);
    }

    @Test
    @DisplayName("Analysis sends balance, pending payouts and completed work to the advisor")
    void analyze_ReturnsAdvice() throws Exception {
        fixtures.pendingPayment(approvalJudge, "0.3");
        when(balanceReader.balanceOf(FUNDING)).thenReturn(new BigDecimal("2"));
        mockMvc.perform(post("/api/budget/refresh").header(AdminApiKeyFilter.API_KEY_HEADER, ADMIN_KEY))
            .andExpect(status().isOk());

        BigDecimal pending = paymentRepository.sumAmountByStatus(PaymentStatus.PENDING);
        long completed = taskRepository.countByStatus(TaskStatus.COMPLETED);
        when(budgetAdvisor.advise(any(), any(), anyLong())).thenReturn(
                BudgetAdvice.of("Top up before the next batch", List.of("Claim creator rewards"), 140));

        mockMvc.perform(get("/api/budget/analyze").header(AdminApiKeyFilter.API_KEY_HEADER, ADMIN_KEY))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.recommendation").value("Top up before the next batch"))
            .andExpect(jsonPath("$.suggested_actions[0]").value("Claim creator rewards"))
            .andExpect(jsonPath("$.health_score").value(100));

        verify(budgetAdvisor).advise(
                argThat(balance -> balance.compareTo(new BigDecimal("2")) == 0),
                argThat(sum -> sum.compareTo(pending) == 0 && sum.compareTo(new BigDecimal("0.3")) >= 0),
                eq(completed));
    }

    @Test
    @DisplayName("Advisor failure answers 502 and analysis stays admin-only")
    void analyze_AdvisorFails_BadGateway() throws Exception {
        when(budgetAdvisor.advise(any(), any(), anyLong())).thenThrow(new IllegalStateException("overloaded"));

        mockMvc.perform(get("/api/budget/analyze").header(AdminApiKeyFilter.API_KEY_HEADER, ADMIN_KEY))
            .andExpect(status().isBadGateway())
            .andExpect(jsonPath("$.error").value("Budget advisor service error"))
            .andExpect(jsonPath("$.message").value(containsString("overloaded")));

        mockMvc.perform(get("/api/budget/analyze"))
            .andExpect(status().isUnauthorized());
        verify(budgetAdvisor, times(1)).advise(any(), any(), anyLong());
    }
}
