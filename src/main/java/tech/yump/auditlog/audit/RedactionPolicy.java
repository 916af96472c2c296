package tech.yump.auditlog.audit;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * What the {@link RedactionEngine} conceals: values under keys matching
 * {@code sensitiveKeyPattern}, and the whole data object of Secret resources,
 * recognised by any of {@code secretPathMarkers} appearing in the request path.
 */
public record RedactionPolicy(Pattern sensitiveKeyPattern, List<String> secretPathMarkers) {

    public static final String REDACTED = "[redacted]";
    public static final String DATA_KEY = "data";
    public static final String STRING_DATA_KEY = "stringData";

    public static final String DEFAULT_SENSITIVE_KEY_PATTERN =
            "(?i)(password|passwd|token|secret|credential|apikey|api_key|private_key|privatekey)";
    public static final List<String> DEFAULT_SECRET_PATH_MARKERS = List.of("secrets");

    public RedactionPolicy {
        Objects.requireNonNull(sensitiveKeyPattern, "sensitiveKeyPattern");
        secretPathMarkers = List.copyOf(secretPathMarkers);
    }

    public static RedactionPolicy of(String sensitiveKeyRegex, List<String> secretPathMarkers) {
        return new RedactionPolicy(Pattern.compile(sensitiveKeyRegex), secretPathMarkers);
    }

    public static RedactionPolicy defaults() {
        return of(DEFAULT_SENSITIVE_KEY_PATTERN, DEFAULT_SECRET_PATH_MARKERS);
    }

    public boolean isSensitiveKey(String key) {
        return sensitiveKeyPattern.matcher(key).find();
    }

    public boolean isSecretPath(String path) {
        if (path == null) {
            return false;
        }
        return secretPathMarkers.stream().anyMatch(path::contains);
    }
}
