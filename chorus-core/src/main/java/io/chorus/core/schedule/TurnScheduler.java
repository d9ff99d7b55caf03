package io.chorus.core.schedule;

import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Random speaker selection that never picks the same participant twice in a row, unless it is
 * the only one available.
 */
public final class TurnScheduler {
    private final Random random;
    private String previous;

    public TurnScheduler() {
        this(new Random());
    }

    public TurnScheduler(Random random) {
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    public String selectNext(List<String> available) {
        return selectNext(available, previous);
    }

    public String selectNext(List<String> available, String previousSpeaker) {
        if (available == null || available.isEmpty()) {
            throw new IllegalArgumentException("available participants must not be empty");
        }
        List<String> candidates = available.stream()
            .filter(name -> !name.equals(previousSpeaker))
            .toList();
        if (candidates.isEmpty()) {
            candidates = available;
        }
        String next = candidates.get(random.nextInt(candidates.size()));
        previous = next;
        return next;
    }

    public String previous() {
        return previous;
    }
}
