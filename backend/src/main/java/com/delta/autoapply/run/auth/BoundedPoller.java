package com.delta.autoapply.run.auth;

import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * Checks a condition at a fixed interval up to a ceiling. Interruption of the polling
 * thread ends the wait with {@link InterruptedException}.
 */
public class BoundedPoller {

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final Duration interval;
    private final int maxAttempts;
    private final Sleeper sleeper;

    public BoundedPoller(Duration interval, int maxAttempts) {
        this(interval, maxAttempts, duration -> Thread.sleep(duration.toMillis()));
    }

    public BoundedPoller(Duration interval, int maxAttempts, Sleeper sleeper) {
        this.interval = interval == null || interval.isNegative() ? Duration.ZERO : interval;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.sleeper = sleeper;
    }

    /**
     * @return true as soon as the condition holds, false once every attempt has failed
     */
    public boolean pollUntil(BooleanSupplier condition) throws InterruptedException {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (Thread.interrupted()) {
                throw new InterruptedException("Polling interrupted after " + (attempt - 1) + " attempts");
            }
            if (condition.getAsBoolean()) {
                return true;
            }
            if (attempt < maxAttempts) {
                sleeper.sleep(interval);
            }
        }
        return false;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
