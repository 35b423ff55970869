package com.flagship.bounty_ledger.collaborator;

/**
 * External services the orchestrators call. Each gets its own bounded executor in
 * {@link BoundedCaller}; the funds executor's is single-threaded.
 */
public enum Collaborator {
    APPROVAL_JUDGE("Approval judge", 4),
    TASK_GENERATOR("Task generator", 1),
    BUDGET_ADVISOR("Budget advisor", 1),
    FUNDS_EXECUTOR("Funds executor", 1),
    CONFIRMATION_CHECKER("Confirmation checker", 2),
    BALANCE_READER("Balance reader", 2),
    REWARDS_SOURCE("Rewards source", 2);

    private final String displayName;
    private final int maxInFlight;

    Collaborator(String displayName, int maxInFlight) {
        this.displayName = displayName;
        this.maxInFlight = maxInFlight;
    }

    public String getDisplayName() {
        return displayName;
    }

    public int getMaxInFlight() {
        return maxInFlight;
    }
}
