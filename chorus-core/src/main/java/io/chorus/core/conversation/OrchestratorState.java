package io.chorus.core.conversation;

public enum OrchestratorState {
    IDLE,
    INITIALIZING,
    RUNNING,
    TERMINATING,
    DONE
}
