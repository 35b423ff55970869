package com.flagship.bounty_ledger.collaborator;

/**
 * Looks up a submitted transfer on the settlement network.
 */
public interface ConfirmationChecker {

    Confirmation confirm(String signature);
}
