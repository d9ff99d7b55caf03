package io.chorus.core.model;

public enum MessageRole {
    SYSTEM,
    USER,
    ASSISTANT
}
