package com.eainde.extraction.budget;

import java.time.Duration;

/**
 * Blocking pause, swappable in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
