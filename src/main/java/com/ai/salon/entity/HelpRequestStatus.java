package com.ai.salon.entity;

/**
 * Help request lifecycle. Only PENDING and RESOLVED are reached by escalation;
 * the other two are reserved for supervisor tooling.
 */
public enum HelpRequestStatus {
    PENDING,
    IN_PROGRESS,
    RESOLVED,
    ESCALATED
}
