package com.example.prsync.dto;

/**
 * A transition Jira currently permits from the issue's status.
 */
public record TransitionStep(String id, String name, String toStatus) {
}
