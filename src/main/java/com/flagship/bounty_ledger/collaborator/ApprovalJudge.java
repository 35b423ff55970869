package com.flagship.bounty_ledger.collaborator;

import com.flagship.bounty_ledger.exception.CollaboratorException;

/**
 * Decides whether a submission's proof satisfies its task.
 *
 * Implementations must distinguish a verdict from a failure to produce one: transport errors,
 * timeouts and unparseable answers raise {@link CollaboratorException} and never come back as
 * a rejected verdict.
 */
public interface ApprovalJudge {

    JudgeVerdict evaluate(JudgeRequest request);
}
