package com.issuelake.pipeline.client;

import java.time.Duration;

/**
 * Blocking wait used between retries. Swapped out in tests to record waits instead of taking them.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
