package com.hashicorp.vault.broker.auth;

import com.hashicorp.vault.broker.MalformedResponseException;
import com.hashicorp.vault.broker.Preconditions;
import com.hashicorp.vault.broker.transport.VaultResponse;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * A Vault client token and its lease metadata.
 *
 * <p>Immutable. The token expires {@code leaseDuration} after {@code issuedAt}; a lease
 * duration of zero marks a token that never expires (Vault reports 0 for root
 * tokens).
 */
public final class VaultToken {

    private final String id;
    private final Duration leaseDuration;
    private final boolean renewable;
    private final Instant issuedAt;

    public VaultToken(String id, Duration leaseDuration, boolean renewable, Instant issuedAt) {
        Preconditions.requireNonBlank(id, "Token");
        if (leaseDuration == null || leaseDuration.isNegative()) {
            throw new IllegalArgumentException("Lease duration must be zero or positive: " + leaseDuration);
        }
        if (issuedAt == null) {
            throw new IllegalArgumentException("Issue time cannot be null");
        }
        this.id = id;
        this.leaseDuration = leaseDuration;
        this.renewable = renewable;
        this.issuedAt = issuedAt;
    }

    /**
     * Reads the {@code auth} block of a login or renew response.
     *
     * @param response the Vault response
     * @param clock    source of the issue time
     * @return the token
     * @throws MalformedResponseException if {@code auth.client_token} is missing or the
     *                                    lease duration is negative
     */
    public static VaultToken fromAuth(VaultResponse response, Clock clock) {
        Map<String, Object> auth = response.getAuth();
        if (auth == null) {
            throw new MalformedResponseException("Login response missing 'auth' field",
                    response.getStatus());
        }

        String clientToken = response.getAuthString("client_token");
        if (clientToken == null || clientToken.isBlank()) {
            throw new MalformedResponseException("Login response missing 'client_token'",
                    response.getStatus());
        }

        long leaseSeconds = response.getAuthLong("lease_duration", 0L);
        if (leaseSeconds < 0) {
            throw new MalformedResponseException("Login response has negative 'lease_duration': "
                    + leaseSeconds, response.getStatus());
        }

        boolean renewable = Boolean.TRUE.equals(auth.get("renewable"));
        return new VaultToken(clientToken, Duration.ofSeconds(leaseSeconds), renewable, clock.instant());
    }

    public String getId() {
        return id;
    }

    public Duration getLeaseDuration() {
        return leaseDuration;
    }

    public boolean isRenewable() {
        return renewable;
    }

    public Instant getIssuedAt() {
        return issuedAt;
    }

    /**
     * Returns true if the token has no expiry.
     */
    public boolean isNonExpiring() {
        return leaseDuration.isZero();
    }

    /**
     * Returns the instant the token expires, or {@link Instant#MAX} for non-expiring tokens.
     *
     * <p>Leases that reach past {@link Instant#MAX} are clamped to it.
     */
    public Instant getExpiresAt() {
        if (isNonExpiring()) {
            return Instant.MAX;
        }
        try {
            return issuedAt.plus(leaseDuration);
        } catch (DateTimeException | ArithmeticException e) {
            return Instant.MAX;
        }
    }

    /**
     * Checks whether the token should be replaced.
     *
     * <p>The margin is capped at half the lease duration, so a short-lived token is
     * still used for the first half of its life.
     *
     * @param now    current time
     * @param margin time before expiry at which the token counts as expiring
     * @return true if {@code now} is within the margin of expiry or past it
     */
    public boolean isExpiring(Instant now, Duration margin) {
        if (isNonExpiring()) {
            return false;
        }
        Duration halfLease = leaseDuration.dividedBy(2);
        Duration effectiveMargin = margin.compareTo(halfLease) > 0 ? halfLease : margin;
        return !now.isBefore(getExpiresAt().minus(effectiveMargin));
    }

    @Override
    public String toString() {
        String prefix = id.length() > 8 ? id.substring(0, 8) + "..." : "***";
        return "VaultToken{" +
                "id='" + prefix + '\'' +
                ", leaseDuration=" + leaseDuration.getSeconds() + "s" +
                ", renewable=" + renewable +
                ", issuedAt=" + issuedAt +
                '}';
    }
}
