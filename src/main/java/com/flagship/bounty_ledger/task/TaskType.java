package com.flagship.bounty_ledger.task;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Category of requested work.
 */
public enum TaskType {
    @JsonProperty("code")
    CODE,
    @JsonProperty("social")
    SOCIAL,
    @JsonProperty("marketing")
    MARKETING,
    @JsonProperty("design")
    DESIGN,
    @JsonProperty("other")
    OTHER;

    public String label() {
        return name().toLowerCase();
    }

    /**
     * Lenient lookup for generated drafts; unknown categories become OTHER.
     */
    public static TaskType fromLabel(String label) {
        if (label == null) {
            return OTHER;
        }
        for (TaskType type : values()) {
            if (type.name().equalsIgnoreCase(label.trim())) {
                return type;
            }
        }
        return OTHER;
    }
}
