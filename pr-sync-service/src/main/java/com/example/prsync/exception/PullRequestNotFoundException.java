package com.example.prsync.exception;

/**
 * No stored record for the requested (owner, repo, number).
 * Maps to HTTP 404.
 */
public class PullRequestNotFoundException extends RuntimeException {

    public PullRequestNotFoundException(String owner, String repo, int number) {
        super("Pull request not found: " + owner + "/" + repo + "#" + number);
    }
}
