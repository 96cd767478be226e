package com.ai.leadqualifier.conversation;

public enum LeadPriority {
    URGENT("urgent"),
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String value;

    LeadPriority(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
