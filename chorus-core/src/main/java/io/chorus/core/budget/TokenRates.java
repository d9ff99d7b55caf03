package io.chorus.core.budget;

/**
 * Cost of one token, in USD, for input and output text.
 */
public record TokenRates(double input, double output) {
    public static final TokenRates FREE = new TokenRates(0.0, 0.0);

    public TokenRates {
        if (input < 0 || output < 0 || Double.isNaN(input) || Double.isNaN(output)) {
            throw new IllegalArgumentException("rates must not be negative");
        }
    }

    public static TokenRates perMillion(double inputPerMillion, double outputPerMillion) {
        return new TokenRates(inputPerMillion / 1_000_000, outputPerMillion / 1_000_000);
    }

    public double cost(long inputTokens, long outputTokens) {
        return inputTokens * input + outputTokens * output;
    }
}
