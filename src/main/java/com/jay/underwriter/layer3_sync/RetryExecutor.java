package com.jay.underwriter.layer3_sync;

import com.jay.underwriter.layer1_data.RecordStoreException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Runs a store call with bounded retries and exponential backoff.
 * Attempt n waits baseDelay × 2^(n-1) before attempt n+1. Only retryable
 * {@link RecordStoreException}s are retried; anything else propagates at once.
 */
@Slf4j
public class RetryExecutor {

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Sleeper sleeper;

    public RetryExecutor(int maxAttempts, Duration baseDelay, Sleeper sleeper) {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.sleeper = sleeper;
    }

    public <T> T execute(String operation, Supplier<T> call) {
        Duration delay = baseDelay;
        for (int attempt = 1; ; attempt++) {
            try {
                return call.get();
            } catch (RecordStoreException e) {
                if (!e.isRetryable()) throw e;
                if (attempt >= maxAttempts) {
                    throw new RecordStoreException(String.format("%s failed after %d attempts: %s",
                        operation, maxAttempts, e.getMessage()), e, false);
                }
                log.warn("{} failed (attempt {}/{}): {} — retrying in {} ms",
                    operation, attempt, maxAttempts, e.getMessage(), delay.toMillis());
                pause(operation, delay);
                delay = delay.multipliedBy(2);
            }
        }
    }

    public void run(String operation, Runnable call) {
        execute(operation, () -> {
            call.run();
            return null;
        });
    }

    private void pause(String operation, Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RecordStoreException(operation + " interrupted during backoff", e, false);
        }
    }
}
