package io.chorus.core.conversation;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative stop signal set by the hosting process (for example from a shutdown hook) and
 * polled by the orchestration loop between turns.
 */
public final class CancellationToken {
    private final CountDownLatch cancelled = new CountDownLatch(1);

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancellationRequested() {
        return cancelled.getCount() == 0;
    }

    /**
     * Waits for {@code duration} or until cancellation, whichever comes first.
     *
     * @return {@code true} if cancellation was requested
     */
    public boolean pause(Duration duration) throws InterruptedException {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return isCancellationRequested();
        }
        return cancelled.await(duration.toMillis(), TimeUnit.MILLISECONDS);
    }
}
