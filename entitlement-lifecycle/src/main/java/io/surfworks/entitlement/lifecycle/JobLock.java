package io.surfworks.entitlement.lifecycle;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

/**
 * Mutual exclusion for the revalidation job, shared across processes.
 */
public interface JobLock {

    /**
     * Try to take the lock, waiting at most {@code timeout}.
     *
     * @return a lease to close when done, or empty if another holder kept it
     */
    Optional<Lease> tryLock(Duration timeout) throws IOException, InterruptedException;

    /**
     * A held lock. Closing releases it.
     */
    interface Lease extends AutoCloseable {
        @Override
        void close();
    }
}
