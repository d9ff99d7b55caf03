package io.chorus.core.participant;

public final class GenerationException extends Exception {
    private final String participant;

    public GenerationException(String participant, String message) {
        super(participant + ": " + message);
        this.participant = participant;
    }

    public GenerationException(String participant, String message, Throwable cause) {
        super(participant + ": " + message, cause);
        this.participant = participant;
    }

    public String participant() {
        return participant;
    }
}
