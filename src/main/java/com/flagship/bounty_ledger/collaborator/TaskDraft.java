package com.flagship.bounty_ledger.collaborator;

import lombok.Value;

import java.math.BigDecimal;

/**
 * An unvalidated task proposal. Drafts are checked like any operator-created task before use.
 */
@Value
public class TaskDraft {
    String title;
    String description;
    String taskType;
    BigDecimal reward;
    String verificationCriteria;
}
