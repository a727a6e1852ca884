package com.example.prsync.exception;

/**
 * A remote call (GitHub or Jira) timed out, failed in transport or returned a server error.
 * The affected item is skipped for the current pass and retried on the next one.
 */
public class RemoteUnavailableException extends RuntimeException {

    private final String remote;

    public RemoteUnavailableException(String remote, String message) {
        super(message);
        this.remote = remote;
    }

    public RemoteUnavailableException(String remote, String message, Throwable cause) {
        super(message, cause);
        this.remote = remote;
    }

    public String getRemote() {
        return remote;
    }
}
