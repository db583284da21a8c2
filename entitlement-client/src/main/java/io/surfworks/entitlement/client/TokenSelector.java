package io.surfworks.entitlement.client;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Picks the activation token a client should hold from a service response.
 *
 * <p>A single activation object yields its token. For a list, live
 * activations outrank deactivated ones regardless of age; within the same
 * group the most recently updated entry wins ({@code updated_at}, else
 * {@code created_at}). Equal scores keep the earlier entry.
 */
public final class TokenSelector {

    private static final Logger LOG = Logger.getLogger(TokenSelector.class.getName());

    private TokenSelector() {}

    public static Optional<String> extractLatestToken(LicenseResponse response) {
        if (response == null) {
            return Optional.empty();
        }
        List<ActivationRecord> activations = response.activations();
        if (response.singleActivation()) {
            ActivationRecord only = activations.get(0);
            LOG.fine("extractLatestToken: single-object token=" + LogFormat.mask(only.token()));
            return only.hasToken() ? Optional.of(only.token()) : Optional.empty();
        }
        return selectLatest(activations).map(ActivationRecord::token);
    }

    /**
     * Best candidate among the records that carry a token.
     */
    public static Optional<ActivationRecord> selectLatest(List<ActivationRecord> activations) {
        ActivationRecord best = null;
        int bestActive = -1;
        long bestRecency = Long.MIN_VALUE;
        int candidates = 0;

        for (ActivationRecord record : activations) {
            if (!record.hasToken()) {
                continue;
            }
            candidates++;
            int active = record.isActive() ? 1 : 0;
            long recency = recency(record);
            if (best == null || active > bestActive || (active == bestActive && recency > bestRecency)) {
                best = record;
                bestActive = active;
                bestRecency = recency;
            }
        }

        LOG.fine("selectLatest: candidates=" + candidates);
        if (best != null) {
            LOG.fine("selectLatest: chosen token=" + LogFormat.mask(best.token())
                + " active=" + best.isActive()
                + " updated_at=" + best.updatedAt()
                + " created_at=" + best.createdAt());
        }
        return Optional.ofNullable(best);
    }

    static long recency(ActivationRecord record) {
        long updated = epochMillis(record.updatedAt());
        return updated != 0 ? updated : epochMillis(record.createdAt());
    }

    private static long epochMillis(String value) {
        return Timestamps.parse(value).map(Instant::toEpochMilli).orElse(0L);
    }
}
