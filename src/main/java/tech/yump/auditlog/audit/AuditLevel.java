package tech.yump.auditlog.audit;

import java.util.Locale;

/**
 * Verbosity of the audit trail. Each level captures everything the level below it does.
 */
public enum AuditLevel {

    /** Auditing disabled; no record is written. */
    NONE("None"),

    /** Identity, method, URI, timing, status and filtered headers. */
    METADATA("Metadata"),

    /** Metadata plus the (redacted) JSON request body of PUT/POST calls. */
    REQUEST("Request"),

    /** Request plus the (redacted) JSON response body. */
    REQUEST_RESPONSE("RequestResponse");

    private final String displayName;

    AuditLevel(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * @return true if this level captures at least what {@code other} captures.
     */
    public boolean includes(AuditLevel other) {
        return compareTo(other) >= 0;
    }

    /**
     * Parses a level by name ("RequestResponse", "request-response", "REQUEST_RESPONSE")
     * or by its numeric value 0-3.
     *
     * @throws IllegalArgumentException if the value names no level.
     */
    public static AuditLevel fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Audit level must not be blank");
        }
        String trimmed = value.trim();
        if (trimmed.chars().allMatch(Character::isDigit)) {
            int ordinal = Integer.parseInt(trimmed);
            AuditLevel[] levels = values();
            if (ordinal >= levels.length) {
                throw new IllegalArgumentException("Unknown audit level: " + value);
            }
            return levels[ordinal];
        }
        String normalized = normalize(trimmed);
        for (AuditLevel level : values()) {
            if (normalize(level.displayName).equals(normalized)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown audit level: " + value);
    }

    private static String normalize(String value) {
        return value.replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return displayName;
    }
}
