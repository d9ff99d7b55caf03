package io.chorus.core.budget;

public final class TokenizationException extends RuntimeException {
    public TokenizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
