package tech.yump.auditlog.audit;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Removes credential-bearing headers before they are attached to an audit record.
 */
public final class HeaderFilter {

    public static final List<String> SENSITIVE_REQUEST_HEADERS = List.of("Cookie", "Authorization");
    public static final List<String> SENSITIVE_RESPONSE_HEADERS = List.of("Cookie", "Set-Cookie");

    private HeaderFilter() {
    }

    /**
     * Returns a new map holding every entry of {@code headers} whose key is not in {@code denyList}.
     * Keys are compared case-sensitively, as stored; callers pass canonical header names.
     */
    public static Map<String, List<String>> filterOut(Map<String, List<String>> headers, Collection<String> denyList) {
        Map<String, List<String>> filtered = new LinkedHashMap<>();
        if (headers == null) {
            return filtered;
        }
        headers.forEach((name, values) -> {
            if (!denyList.contains(name)) {
                filtered.put(name, values);
            }
        });
        return filtered;
    }

    /**
     * Canonical MIME header form: first letter and every letter after a hyphen upper case,
     * everything else lower case ({@code x-trace-id} becomes {@code X-Trace-Id}).
     */
    public static String canonicalName(String name) {
        StringBuilder sb = new StringBuilder(name.length());
        boolean upper = true;
        for (char c : name.toCharArray()) {
            sb.append(upper ? Character.toUpperCase(c) : Character.toLowerCase(c));
            upper = c == '-';
        }
        return sb.toString();
    }
}
