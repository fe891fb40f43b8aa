package com.hashicorp.vault.broker;

import com.hashicorp.vault.broker.transport.VaultResponse;
import java.time.Duration;
import java.util.Map;

/**
 * The result of a secret read: the secret payload and its lease metadata.
 *
 * <p>Reads of static secrets (for example KV) come back without a lease; their lease ID
 * is empty, the duration is zero and they are not renewable.
 */
public final class Lease {

    private final Map<String, Object> data;
    private final String leaseId;
    private final Duration leaseDuration;
    private final boolean renewable;

    private Lease(Map<String, Object> data, String leaseId, Duration leaseDuration, boolean renewable) {
        this.data = data;
        this.leaseId = leaseId;
        this.leaseDuration = leaseDuration;
        this.renewable = renewable;
    }

    /**
     * Builds a lease from a read response.
     *
     * @param response the Vault response
     * @return the lease
     * @throws MalformedResponseException if the response has no {@code data} object or a
     *                                    negative lease duration
     */
    public static Lease fromResponse(VaultResponse response) {
        Map<String, Object> data = response.getData();
        if (data == null) {
            throw new MalformedResponseException("Read response missing 'data' field", response.getStatus());
        }

        if (!response.hasLeaseDuration()) {
            return new Lease(data, leaseIdOf(response), Duration.ZERO, false);
        }

        long seconds = response.getLeaseDuration();
        if (seconds < 0) {
            throw new MalformedResponseException("Read response has negative 'lease_duration': " + seconds,
                    response.getStatus());
        }
        return new Lease(data, leaseIdOf(response), Duration.ofSeconds(seconds), response.isRenewable());
    }

    private static String leaseIdOf(VaultResponse response) {
        return response.getLeaseId() != null ? response.getLeaseId() : "";
    }

    /** The secret payload. Unmodifiable. */
    public Map<String, Object> getData() {
        return data;
    }

    /** Lease ID, empty for reads without a lease. */
    public String getLeaseId() {
        return leaseId;
    }

    public Duration getLeaseDuration() {
        return leaseDuration;
    }

    public boolean isRenewable() {
        return renewable;
    }

    /**
     * Returns true for a read without lease metadata.
     */
    public boolean isStatic() {
        return leaseDuration.isZero() && !renewable;
    }

    @Override
    public String toString() {
        // Secret values stay out of logs
        return "Lease{" +
                "leaseId='" + leaseId + '\'' +
                ", leaseDuration=" + leaseDuration.getSeconds() + "s" +
                ", renewable=" + renewable +
                ", keys=" + data.keySet() +
                '}';
    }
}
