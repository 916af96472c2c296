package tech.yump.auditlog.audit;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.lang.NonNull;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingResponseWrapper;
import tech.yump.auditlog.auth.AuditUserResolver;

import java.io.IOException;

/**
 * Writes one audit record per request. Must run after authentication so the resolved
 * identity is available once the downstream chain returns.
 * <p>
 * Requests that end with an exception produce no record.
 */
@Slf4j
public class AuditLogFilter extends OncePerRequestFilter {

  public static final String MDC_AUDIT_ID_KEY = "auditID";

  private final AuditLogWriter auditLogWriter;
  private final AuditUserResolver auditUserResolver;

  public AuditLogFilter(AuditLogWriter auditLogWriter, AuditUserResolver auditUserResolver) {
    this.auditLogWriter = auditLogWriter;
    this.auditUserResolver = auditUserResolver;
  }

  @Override
  protected void doFilterInternal(
          @NonNull HttpServletRequest request,
          @NonNull HttpServletResponse response,
          @NonNull FilterChain filterChain) throws ServletException, IOException {

    AuditSession session = auditLogWriter.newSession(request);

    ContentCachingResponseWrapper cachingResponse = auditLogWriter.getLevel().includes(AuditLevel.REQUEST_RESPONSE)
            ? new ContentCachingResponseWrapper(response)
            : null;
    byte[] responseBody = null;

    MDC.put(MDC_AUDIT_ID_KEY, session.auditId());
    try {
      filterChain.doFilter(session.request(), cachingResponse != null ? cachingResponse : response);
    } finally {
      MDC.remove(MDC_AUDIT_ID_KEY);
      if (cachingResponse != null) {
        responseBody = cachingResponse.getContentAsByteArray();
        cachingResponse.copyBodyToResponse();
      }
    }

    writeRecord(session, response, responseBody);
  }

  private void writeRecord(AuditSession session, HttpServletResponse response, byte[] responseBody) {
    HttpServletRequest request = session.request();
    try {
      AuditUser user = auditUserResolver.resolve(SecurityContextHolder.getContext().getAuthentication(), request);
      session.write(
              user,
              ServletHeaders.of(request),
              ServletHeaders.of(response),
              response.getStatus(),
              responseBody);
    } catch (AuditWriteException e) {
      log.error("Failed to write audit record {} for {} {}: {}",
              session.auditId(), request.getMethod(), request.getRequestURI(), e.getMessage(), e);
    }
  }

  @Override
  protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
    return !auditLogWriter.isEnabled();
  }
}
