package com.example.prsync.exception;

/**
 * A mutation was requested for an issue that is not linked to one of the tracked account's pull requests.
 * Maps to HTTP 403.
 */
public class AuthorizationDeniedException extends RuntimeException {

    public AuthorizationDeniedException(String message) {
        super(message);
    }
}
