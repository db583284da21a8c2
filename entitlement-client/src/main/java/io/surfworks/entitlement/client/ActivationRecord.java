package io.surfworks.entitlement.client;

/**
 * One activation entry as reported by the license service. Timestamps are
 * kept as the raw strings the service sent.
 *
 * @param token         activation token (may be null)
 * @param createdAt     creation timestamp (may be null)
 * @param updatedAt     last update timestamp (may be null)
 * @param deactivatedAt deactivation timestamp, null while the activation is live
 */
public record ActivationRecord(
    String token,
    String createdAt,
    String updatedAt,
    String deactivatedAt
) {

    public boolean isActive() {
        return deactivatedAt == null || deactivatedAt.isBlank();
    }

    public boolean hasToken() {
        return token != null && !token.isBlank();
    }
}
