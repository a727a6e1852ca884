package com.example.prsync.exception;

/**
 * The requested operation needs configuration that is missing
 * (Jira integration disabled, no target statuses for a lane).
 * Maps to HTTP 422; not retried.
 */
public class ConfigurationGapException extends RuntimeException {

    public ConfigurationGapException(String message) {
        super(message);
    }
}
