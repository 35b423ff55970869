package com.flagship.bounty_ledger.collaborator;

import java.math.BigDecimal;

/**
 * Reviews the funding position against outstanding payouts.
 */
public interface BudgetAdvisor {

    BudgetAdvice advise(BigDecimal balance, BigDecimal pendingPayments, long completedTasks);
}
