package tech.yump.auditlog.audit;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads servlet headers into maps keyed by canonical header name, the form
 * {@link HeaderFilter} deny lists are written in.
 */
public final class ServletHeaders {

    private ServletHeaders() {
    }

    public static Map<String, List<String>> of(HttpServletRequest request) {
        Map<String, List<String>> headers = new TreeMap<>();
        for (String name : Collections.list(request.getHeaderNames())) {
            // getHeaders is case-insensitive: the first spelling of a name already holds every value
            headers.putIfAbsent(HeaderFilter.canonicalName(name), Collections.list(request.getHeaders(name)));
        }
        return headers;
    }

    /**
     * Collects response headers. Containers may keep {@code Content-Type} outside the header
     * map until commit, so it is added from {@link HttpServletResponse#getContentType()} when missing.
     */
    public static Map<String, List<String>> of(HttpServletResponse response) {
        Map<String, List<String>> headers = new TreeMap<>();
        for (String name : response.getHeaderNames()) {
            headers.putIfAbsent(HeaderFilter.canonicalName(name), new ArrayList<>(response.getHeaders(name)));
        }
        if (response.getContentType() != null && !headers.containsKey(HttpHeaders.CONTENT_TYPE)) {
            headers.put(HttpHeaders.CONTENT_TYPE, List.of(response.getContentType()));
        }
        return headers;
    }

    /**
     * @return the first value of {@code name} in {@code headers}, matching the name case-insensitively, or null.
     */
    public static String first(Map<String, List<String>> headers, String name) {
        if (headers == null) {
            return null;
        }
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            if (name.equalsIgnoreCase(entry.getKey()) && entry.getValue() != null && !entry.getValue().isEmpty()) {
                return entry.getValue().get(0);
            }
        }
        return null;
    }

    /**
     * @return true if the content type is {@code application/json}, ignoring parameters such as charset.
     */
    public static boolean isJson(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return false;
        }
        try {
            return MediaType.APPLICATION_JSON.equalsTypeAndSubtype(MediaType.parseMediaType(contentType));
        } catch (InvalidMediaTypeException e) {
            return false;
        }
    }
}
