package com.flagship.bounty_ledger;

import com.flagship.bounty_ledger.collaborator.ApprovalJudge;
import com.flagship.bounty_ledger.collaborator.BalanceReader;
import com.flagship.bounty_ledger.collaborator.BudgetAdvisor;
import com.flagship.bounty_ledger.collaborator.ConfirmationChecker;
import com.flagship.bounty_ledger.collaborator.FundsExecutor;
import com.flagship.bounty_ledger.collaborator.RewardsSource;
import com.flagship.bounty_ledger.collaborator.TaskGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

/**
 * Full application on H2 with every external collaborator mocked. Subclasses share one context.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
public abstract class IntegrationTestSupport {

    @MockBean
    protected ApprovalJudge approvalJudge;

    @MockBean
    protected TaskGenerator taskGenerator;

    @MockBean
    protected FundsExecutor fundsExecutor;

    @MockBean
    protected ConfirmationChecker confirmationChecker;

    @MockBean
    protected BalanceReader balanceReader;

    @MockBean
    protected RewardsSource rewardsSource;

    @MockBean
    protected BudgetAdvisor budgetAdvisor;

    @Autowired
    protected ApplicationContext applicationContext;

    protected BountyFixtures fixtures;

    @BeforeEach
    void setUpFixtures() {
        fixtures = new BountyFixtures(applicationContext);
    }
}
