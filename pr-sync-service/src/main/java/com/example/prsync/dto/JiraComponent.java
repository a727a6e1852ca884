package com.example.prsync.dto;

/**
 * A component defined on a Jira project.
 */
public record JiraComponent(String id, String name) {
}
