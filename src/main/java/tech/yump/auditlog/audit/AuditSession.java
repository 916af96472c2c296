package tech.yump.auditlog.audit;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;

import java.util.List;
import java.util.Map;

/**
 * Audit state of a single request, from arrival ({@code CREATED}) to the one record
 * written at response completion ({@code FINALIZED}). Owned by the request that opened it
 * and never shared with other requests.
 */
public class AuditSession {

    enum State { CREATED, FINALIZED }

    private final AuditLogWriter writer;
    private final AuditRecord record;
    private final HttpServletRequest request;
    private final byte[] requestBody;
    private State state = State.CREATED;

    AuditSession(AuditLogWriter writer, AuditRecord record, HttpServletRequest request, byte[] requestBody) {
        this.writer = writer;
        this.record = record;
        this.request = request;
        this.requestBody = requestBody;
    }

    public String auditId() {
        return record.auditId();
    }

    /**
     * @return the request downstream handlers must receive; wraps the original when its body was captured.
     */
    public HttpServletRequest request() {
        return request;
    }

    State state() {
        return state;
    }

    /**
     * Completes the record with the response side and writes it to the sink, once.
     *
     * @param user            identity resolved for the request.
     * @param requestHeaders  request headers keyed by canonical name.
     * @param responseHeaders response headers keyed by canonical name.
     * @param responseCode    HTTP status sent to the client.
     * @param responseBody    response payload, or null if it was not observed.
     * @throws AuditWriteException  if the record could not be produced or written.
     * @throws IllegalStateException if the session was already written.
     */
    public void write(AuditUser user,
                      Map<String, List<String>> requestHeaders,
                      Map<String, List<String>> responseHeaders,
                      int responseCode,
                      byte[] responseBody) {
        if (state != State.CREATED) {
            throw new IllegalStateException("Audit session " + auditId() + " has already been written");
        }
        state = State.FINALIZED;

        AuditRecord completed = record.toBuilder()
                .user(user)
                .responseTimestamp(writer.now())
                .responseCode(responseCode > 0 ? responseCode : null)
                .requestHeader(HeaderFilter.filterOut(requestHeaders, HeaderFilter.SENSITIVE_REQUEST_HEADERS))
                .responseHeader(HeaderFilter.filterOut(responseHeaders, HeaderFilter.SENSITIVE_RESPONSE_HEADERS))
                .build();

        AuditLevel level = writer.getLevel();
        RedactionEngine redactionEngine = writer.getRedactionEngine();

        byte[] redactedRequest = null;
        if (level.includes(AuditLevel.REQUEST) && requestBody != null && requestBody.length > 0) {
            redactedRequest = redactionEngine.redact(record.requestURI(), requestBody);
        }

        byte[] redactedResponse = null;
        if (level.includes(AuditLevel.REQUEST_RESPONSE)
                && responseBody != null && responseBody.length > 0
                && ServletHeaders.isJson(ServletHeaders.first(responseHeaders, HttpHeaders.CONTENT_TYPE))) {
            redactedResponse = redactionEngine.redact(record.requestURI(), responseBody);
        }

        byte[] line = writer.getRecordAssembler().assemble(completed, redactedRequest, redactedResponse, level);
        writer.getSink().write(line);
    }
}
