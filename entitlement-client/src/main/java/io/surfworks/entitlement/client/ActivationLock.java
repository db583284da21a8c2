package io.surfworks.entitlement.client;

import java.time.Duration;

/**
 * Short-lived advisory lock that keeps duplicate activation calls from
 * reaching the service.
 *
 * <p>Implementations may throw a {@link RuntimeException} when their backing
 * store is unavailable; the client then proceeds as if the lock was acquired.
 */
@FunctionalInterface
public interface ActivationLock {

    /**
     * Set {@code key} if absent, expiring after {@code ttl}.
     *
     * @return true if this call acquired the key
     */
    boolean tryAcquire(String key, Duration ttl);
}
