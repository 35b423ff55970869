package com.flagship.bounty_ledger.collaborator;

import java.math.BigDecimal;
import java.util.List;

/**
 * Drafts tasks for a project from a free-text context and an overall budget.
 */
public interface TaskGenerator {

    List<TaskDraft> generate(String projectContext, BigDecimal budget, int count);
}
