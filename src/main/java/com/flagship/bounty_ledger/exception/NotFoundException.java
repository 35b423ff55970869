package com.flagship.bounty_ledger.exception;

import java.util.UUID;

/**
 * Raised when a Task, Submission, Payment or User id does not resolve.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException of(String entity, UUID id) {
        return new NotFoundException(entity + " not found: " + id);
    }
}
