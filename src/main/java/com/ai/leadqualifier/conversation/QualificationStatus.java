package com.ai.leadqualifier.conversation;

/**
 * State machine for a lead qualification conversation.
 * IN_PROGRESS is the only non-terminal state; nothing leaves a terminal state.
 */
public enum QualificationStatus {
    IN_PROGRESS("in_progress"),
    QUALIFIED("qualified"),
    DISQUALIFIED("disqualified"),
    ESCALATED("escalated"),
    TIMEOUT("timeout");

    private final String value;

    QualificationStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return this != IN_PROGRESS;
    }

    public boolean canTransitionTo(QualificationStatus next) {
        return this == IN_PROGRESS && next != null && next.isTerminal();
    }
}
