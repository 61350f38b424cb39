package com.groundgate.core.retry;

import java.time.Duration;

/**
 * Blocking wait between attempts. Swapped out in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
