package com.flagship.bounty_ledger.health;

import com.flagship.bounty_ledger.IntegrationTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class HealthControllerTest extends IntegrationTestSupport {

    @Autowired
    private MockMvc mockMvc;

    @Test
    @DisplayName("Health reports the database and which collaborators are configured")
    void health_Up() throws Exception {
        mockMvc.perform(get("/api/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("UP"))
            .andExpect(jsonPath("$.database").value("UP"))
            .andExpect(jsonPath("$.services.approval_judge").value(false))
            .andExpect(jsonPath("$.services.admin_api").value(true))
            .andExpect(jsonPath("$.services.solana.configured").value(false))
            .andExpect(jsonPath("$.services.solana.funding_address")
                    .value("So11111111111111111111111111111111111111112"))
            .andExpect(jsonPath("$.services.solana.network").value("devnet"));
    }
}
