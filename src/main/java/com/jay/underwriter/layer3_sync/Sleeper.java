package com.jay.underwriter.layer3_sync;

import java.time.Duration;

/** Backoff pause between retry attempts. Replaced by a recording fake in tests. */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = delay -> Thread.sleep(delay.toMillis());

    void sleep(Duration delay) throws InterruptedException;
}
