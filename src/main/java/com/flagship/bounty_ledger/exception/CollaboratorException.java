package com.flagship.bounty_ledger.exception;

/**
 * Failure of an external collaborator (judge, funds executor, confirmation checker,
 * rewards source). Never a domain verdict: a judge that could not answer is not a rejection.
 */
public class CollaboratorException extends RuntimeException {

    private final String collaborator;

    public CollaboratorException(String collaborator, String message) {
        super(message);
        this.collaborator = collaborator;
    }

    public CollaboratorException(String collaborator, String message, Throwable cause) {
        super(message, cause);
        this.collaborator = collaborator;
    }

    public String getCollaborator() {
        return collaborator;
    }
}
