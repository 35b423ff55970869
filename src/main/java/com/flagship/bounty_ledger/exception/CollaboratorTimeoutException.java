package com.flagship.bounty_ledger.exception;

import java.time.Duration;

/**
 * A collaborator did not answer within its configured bound.
 */
public class CollaboratorTimeoutException extends CollaboratorException {

    public CollaboratorTimeoutException(String collaborator, Duration timeout) {
        super(collaborator, collaborator + " timed out after " + timeout.toSeconds() + "s");
    }
}
