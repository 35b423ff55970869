package com.flagship.bounty_ledger.exception;

/**
 * The operation is not valid for the record's current status.
 *
 * Extends {@link IllegalStateException} so domain transition methods can raise it
 * the same way they raise any invalid-state error.
 */
public class ConflictException extends IllegalStateException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
