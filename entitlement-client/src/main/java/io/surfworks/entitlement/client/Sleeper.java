package io.surfworks.entitlement.client;

import java.time.Duration;

/**
 * Blocks between retry attempts.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
