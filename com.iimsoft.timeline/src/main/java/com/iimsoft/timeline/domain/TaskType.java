package com.iimsoft.timeline.domain;

/**
 * PROJECT and TAG bars are envelopes: while a descendant is dragged they are resized to enclose it.
 */
public enum TaskType {
    PLAIN,
    PROJECT,
    TAG;

    public boolean isEnvelope() {
        return this == PROJECT || this == TAG;
    }

    public static TaskType fromName(String name) {
        if (name == null || name.isBlank()) {
            return PLAIN;
        }
        switch (name.trim().toLowerCase()) {
            case "project":
                return PROJECT;
            case "tag":
                return TAG;
            default:
                return PLAIN;
        }
    }
}
