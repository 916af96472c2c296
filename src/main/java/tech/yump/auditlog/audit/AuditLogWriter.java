package tech.yump.auditlog.audit;

import jakarta.servlet.http.HttpServletRequest;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;

import java.io.IOException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Set;
import java.util.UUID;

/**
 * Process-wide entry point of the audit trail. Holds the immutable configuration
 * (level, redaction policy, sink) shared by every request and opens one
 * {@link AuditSession} per request.
 */
@Slf4j
@Getter
public class AuditLogWriter {

    static final Set<String> BODY_METHODS = Set.of("PUT", "POST");

    private final AuditLevel level;
    private final RedactionEngine redactionEngine;
    private final RecordAssembler recordAssembler;
    private final AuditSink sink;
    private final Clock clock;

    public AuditLogWriter(AuditLevel level, RedactionEngine redactionEngine, RecordAssembler recordAssembler,
                          AuditSink sink, Clock clock) {
        this.level = level;
        this.redactionEngine = redactionEngine;
        this.recordAssembler = recordAssembler;
        this.sink = sink;
        this.clock = clock;
    }

    public boolean isEnabled() {
        return level != AuditLevel.NONE;
    }

    /**
     * Opens the audit session for {@code request}. For JSON PUT/POST requests at level
     * {@link AuditLevel#REQUEST} or above the body is read here; downstream processing must then
     * use {@link AuditSession#request()}, which replays the same bytes.
     *
     * @throws IOException if the request body cannot be read. No session exists in that case.
     */
    public AuditSession newSession(HttpServletRequest request) throws IOException {
        AuditRecord record = AuditRecord.builder()
                .auditId(UUID.randomUUID().toString())
                .requestURI(requestUri(request))
                .method(request.getMethod())
                .remoteAddr(request.getRemoteAddr())
                .requestTimestamp(now())
                .build();

        if (!shouldCaptureBody(request)) {
            return new AuditSession(this, record, request, null);
        }
        CachedBodyHttpServletRequest cached = CachedBodyHttpServletRequest.capture(request);
        log.trace("Captured {} byte request body for audit record {}", cached.getCachedBody().length, record.auditId());
        return new AuditSession(this, record, cached, cached.getCachedBody());
    }

    String now() {
        return OffsetDateTime.now(clock)
                .truncatedTo(ChronoUnit.SECONDS)
                .format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
    }

    private boolean shouldCaptureBody(HttpServletRequest request) {
        return level.includes(AuditLevel.REQUEST)
                && BODY_METHODS.contains(request.getMethod())
                && ServletHeaders.isJson(request.getHeader(HttpHeaders.CONTENT_TYPE));
    }

    private static String requestUri(HttpServletRequest request) {
        String query = request.getQueryString();
        return query == null ? request.getRequestURI() : request.getRequestURI() + "?" + query;
    }
}
