package com.flagship.bounty_ledger.exception;

/**
 * Login failed. Rendered as 401.
 */
public class InvalidCredentialsException extends RuntimeException {

    public InvalidCredentialsException(String message) {
        super(message);
    }
}
