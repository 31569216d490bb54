package com.ai.salon.conversation;

/**
 * Coarse position of a conversation, as reported to escalation context.
 */
public enum ConversationState {
    GREETING,
    INQUIRY,
    BOOKING,
    READY_FOR_CONFIRMATION,
    COMPLETED
}
