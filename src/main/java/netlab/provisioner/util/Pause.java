package netlab.provisioner.util;

import java.time.Duration;

/**
 * Fixed waits between console steps.
 */
public final class Pause {

    private Pause() {
    }

    /**
     * Sleep for {@code duration}. Zero or negative durations return at once.
     * An interrupt ends the wait early and keeps the thread's interrupt flag set.
     */
    public static void sleep(Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
