package io.chorus.core.budget;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;

/**
 * cl100k_base token counts, used for every participant so budgets stay comparable across
 * backends.
 */
public final class JtokkitTokenCounter implements TokenCounter {
    private final Encoding encoding;

    public JtokkitTokenCounter() {
        this(EncodingType.CL100K_BASE);
    }

    public JtokkitTokenCounter(EncodingType type) {
        EncodingRegistry registry = Encodings.newDefaultEncodingRegistry();
        this.encoding = registry.getEncoding(type);
    }

    @Override
    public int count(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        try {
            return encoding.countTokens(text);
        } catch (RuntimeException | OutOfMemoryError e) {
            throw new TokenizationException("Failed to count tokens for text of length " + text.length(), e);
        }
    }
}
