package com.flagship.bounty_ledger.collaborator;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * What the judge sees: the task's requirements and the worker's proof.
 */
@Value
@Builder
public class JudgeRequest {
    String taskTitle;
    String taskDescription;
    String taskType;
    BigDecimal reward;
    String verificationCriteria;
    String proofType;
    String proofData;
    String proofDescription;
}
