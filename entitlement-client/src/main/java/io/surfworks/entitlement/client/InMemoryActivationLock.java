package io.surfworks.entitlement.client;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local {@link ActivationLock}: a map of keys to expiry instants.
 * Keys are never released early; they lapse once their TTL passes and are
 * dropped on the next acquire attempt.
 */
public class InMemoryActivationLock implements ActivationLock {

    private final ConcurrentMap<String, Instant> expiries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryActivationLock() {
        this(Clock.systemUTC());
    }

    public InMemoryActivationLock(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean tryAcquire(String key, Duration ttl) {
        Instant now = clock.instant();
        Instant expiry = now.plus(ttl);
        expiries.values().removeIf(held -> !held.isAfter(now));
        boolean[] acquired = {false};
        expiries.compute(key, (k, current) -> {
            if (current == null || !current.isAfter(now)) {
                acquired[0] = true;
                return expiry;
            }
            return current;
        });
        return acquired[0];
    }

    int size() {
        return expiries.size();
    }
}
