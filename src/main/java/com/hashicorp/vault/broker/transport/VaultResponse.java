package com.hashicorp.vault.broker.transport;

import com.hashicorp.vault.broker.MalformedResponseException;
import java.util.Collections;
import java.util.Map;

/**
 * A successful response from the Vault API.
 *
 * <p>Vault responses typically have this structure:
 * <pre>{@code
 * {
 *   "data": { ... },       // For secret/logical operations
 *   "auth": { ... },       // For authentication operations
 *   "lease_id": "...",
 *   "lease_duration": 3600,
 *   "renewable": true
 * }
 * }</pre>
 */
public class VaultResponse {

    private final int status;
    private final Map<String, Object> data;
    private final Map<String, Object> auth;
    private final String leaseId;
    private final Long leaseDuration;
    private final boolean renewable;

    private VaultResponse(int status, Map<String, Object> data, Map<String, Object> auth,
                          String leaseId, Long leaseDuration, boolean renewable) {
        this.status = status;
        this.data = data;
        this.auth = auth;
        this.leaseId = leaseId;
        this.leaseDuration = leaseDuration;
        this.renewable = renewable;
    }

    /**
     * Parses a JSON response body into a VaultResponse.
     *
     * <p>An empty body (for example a 204 after a write) yields a response with no
     * data, auth or lease fields.
     *
     * @param status the HTTP status code
     * @param json   the JSON response body
     * @return the parsed response
     * @throws MalformedResponseException if the body is not a JSON object or
     *                                    {@code data}/{@code auth} are not objects
     */
    public static VaultResponse fromJson(int status, String json) {
        if (json == null || json.isBlank()) {
            return new VaultResponse(status, null, null, null, null, false);
        }
        return fromMap(status, Json.parseObject(json));
    }

    /**
     * Builds a response from an already parsed JSON object.
     */
    public static VaultResponse fromMap(int status, Map<String, Object> root) {
        Map<String, Object> data = objectField(root, "data", status);
        Map<String, Object> auth = objectField(root, "auth", status);

        Object leaseIdValue = root.get("lease_id");
        String leaseId = leaseIdValue instanceof String ? (String) leaseIdValue : null;

        Object leaseDurationValue = root.get("lease_duration");
        Long leaseDuration = leaseDurationValue instanceof Number
                ? ((Number) leaseDurationValue).longValue()
                : null;

        boolean renewable = Boolean.TRUE.equals(root.get("renewable"));

        return new VaultResponse(status, data, auth, leaseId, leaseDuration, renewable);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> objectField(Map<String, Object> root, String name, int status) {
        Object value = root.get(name);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map)) {
            throw new MalformedResponseException(
                    "Vault response field '" + name + "' is not an object", status);
        }
        return Collections.unmodifiableMap((Map<String, Object>) value);
    }

    public int getStatus() {
        return status;
    }

    /** Contains response data for secret operations and token lookups. */
    public Map<String, Object> getData() {
        return data;
    }

    /** Contains authentication info (token, policies) for login operations. */
    public Map<String, Object> getAuth() {
        return auth;
    }

    public String getLeaseId() {
        return leaseId;
    }

    /**
     * Returns true when the response carried a numeric {@code lease_duration}.
     */
    public boolean hasLeaseDuration() {
        return leaseDuration != null;
    }

    public long getLeaseDuration() {
        return leaseDuration != null ? leaseDuration : 0L;
    }

    public boolean isRenewable() {
        return renewable;
    }

    public String getDataString(String key) {
        return stringValue(data, key);
    }

    public long getDataLong(String key, long defaultValue) {
        return longValue(data, key, defaultValue);
    }

    public String getAuthString(String key) {
        return stringValue(auth, key);
    }

    public long getAuthLong(String key, long defaultValue) {
        return longValue(auth, key, defaultValue);
    }

    private static String stringValue(Map<String, Object> section, String key) {
        if (section == null) {
            return null;
        }
        Object value = section.get(key);
        return value instanceof String ? (String) value : null;
    }

    private static long longValue(Map<String, Object> section, String key, long defaultValue) {
        if (section == null) {
            return defaultValue;
        }
        Object value = section.get(key);
        return value instanceof Number ? ((Number) value).longValue() : defaultValue;
    }
}
