package com.flagship.bounty_ledger.collaborator.anthropic;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.bounty_ledger.collaborator.BudgetAdvice;
import com.flagship.bounty_ledger.collaborator.Collaborator;
import com.flagship.bounty_ledger.config.BountyProperties;
import com.flagship.bounty_ledger.exception.CollaboratorException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.client.RestClient;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AnthropicBudgetAdvisorTest {

    private static final String NAME = Collaborator.BUDGET_ADVISOR.getDisplayName();

    private AnthropicClient client;
    private AnthropicBudgetAdvisor advisor;

    @BeforeEach
    void setUp() {
        AnthropicClient parser = new AnthropicClient(RestClient.builder(), new BountyProperties(), new ObjectMapper());
        client = mock(AnthropicClient.class);
        when(client.parseJson(anyString(), anyString()))
                .thenAnswer(invocation -> parser.parseJson(invocation.getArgument(0), invocation.getArgument(1)));
        advisor = new AnthropicBudgetAdvisor(client);
    }

    @Test
    @DisplayName("Fenced reply becomes advice with the health score clamped")
    void advise_FencedReply_Parsed() {
        when(client.complete(eq(NAME), isNull(), anyString(), eq(512))).thenReturn("""
                ```json
                {"recommendation": "Pending payouts exceed the balance", "suggestedActions": ["Claim rewards", "Pause new tasks"], "healthScore": 130}
                ```""");

        BudgetAdvice advice = advisor.advise(new BigDecimal("1.5"), new BigDecimal("2.25"), 7);

        assertEquals("Pending payouts exceed the balance", advice.getRecommendation());
        assertEquals(List.of("Claim rewards", "Pause new tasks"), advice.getSuggestedActions());
        assertEquals(100, advice.getHealthScore());

        ArgumentCaptor<Object> prompt = ArgumentCaptor.forClass(Object.class);
        verify(client).complete(eq(NAME), isNull(), prompt.capture(), eq(512));
        String text = assertInstanceOf(String.class, prompt.getValue());
        assertTrue(text.contains("Current Balance: 1.5 SOL"));
        assertTrue(text.contains("Pending Payments: 2.25 SOL"));
        assertTrue(text.contains("Completed Tasks: 7"));
    }

    @Test
    @DisplayName("Negative score is clamped to zero and missing actions become an empty list")
    void advise_NegativeScore_ClampedToZero() {
        when(client.complete(eq(NAME), isNull(), anyString(), eq(512)))
                .thenReturn("{\"recommendation\": \"Critical\", \"healthScore\": -20}");

        BudgetAdvice advice = advisor.advise(BigDecimal.ZERO, BigDecimal.ONE, 0);

        assertEquals(0, advice.getHealthScore());
        assertTrue(advice.getSuggestedActions().isEmpty());
    }

    @Test
    @DisplayName("Reply without a recommendation or with broken JSON is a collaborator failure")
    void advise_NoRecommendation_CollaboratorError() {
        when(client.complete(eq(NAME), isNull(), anyString(), eq(512))).thenReturn("{\"healthScore\": 80}");
        assertThrows(CollaboratorException.class, () -> advisor.advise(BigDecimal.ONE, BigDecimal.ZERO, 1));

        when(client.complete(eq(NAME), isNull(), anyString(), eq(512))).thenReturn("Looks fine to me");
        assertThrows(CollaboratorException.class, () -> advisor.advise(BigDecimal.ONE, BigDecimal.ZERO, 1));
    }
}
