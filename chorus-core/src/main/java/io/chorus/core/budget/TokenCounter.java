package io.chorus.core.budget;

@FunctionalInterface
public interface TokenCounter {
    /**
     * @throws TokenizationException when the tokenizer cannot process the text
     */
    int count(String text);
}
