package com.eyelevel.dispatcher.dispatch;

import com.eyelevel.dispatcher.config.DispatchConfig;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Delay before a failed task is offered to its service again: exponential in the failure count, capped,
 * and scaled by a random factor in [0.5, 1.0) so that retries of a burst of failures spread out.
 */
@Component
public class RetryBackoffPolicy {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final DoubleSupplier random;

    @Autowired
    public RetryBackoffPolicy(final DispatchConfig dispatchConfig) {
        this(dispatchConfig.getRetry().getBaseDelayMs(), dispatchConfig.getRetry().getMaxDelayMs(),
             () -> ThreadLocalRandom.current().nextDouble());
    }

    RetryBackoffPolicy(final long baseDelayMs, final long maxDelayMs, final DoubleSupplier random) {
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.random = random;
    }

    /**
     * @param failureCount failures recorded so far, at least 1
     */
    public Duration delayFor(final int failureCount) {
        final int exponent = Math.min(Math.max(failureCount, 1) - 1, 30);
        final long exponential = baseDelayMs > (maxDelayMs >> exponent) ? maxDelayMs : baseDelayMs << exponent;
        final double factor = 0.5 + 0.5 * random.getAsDouble();
        return Duration.ofMillis((long) (exponential * factor));
    }
}
