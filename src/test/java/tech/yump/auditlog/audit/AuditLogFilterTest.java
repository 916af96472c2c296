package tech.yump.auditlog.audit;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.util.StreamUtils;
import tech.yump.auditlog.auth.AuditUserResolver;
import tech.yump.auditlog.auth.StaticTokenAuthFilter;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

class AuditLogFilterTest {

    private static final String REQUEST_JSON = "{\"user\":\"alice\",\"password\":\"hunter2\"}";
    private static final String RESPONSE_JSON = "{\"id\":7,\"apiKey\":\"k-123\"}";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AuditUserResolver auditUserResolver = new AuditUserResolver();

    private ByteArrayOutputStream output;
    private MockHttpServletRequest request;
    private MockHttpServletResponse response;

    private ListAppender<ILoggingEvent> filterLog;
    private Logger filterLogger;

    @BeforeEach
    void setUp() {
        SecurityContextHolder.clearContext();
        output = new ByteArrayOutputStream();

        request = new MockHttpServletRequest("POST", "/v1/accounts");
        request.setContentType(MediaType.APPLICATION_JSON_VALUE);
        request.setContent(REQUEST_JSON.getBytes(StandardCharsets.UTF_8));
        response = new MockHttpServletResponse();

        filterLogger = (Logger) LoggerFactory.getLogger(AuditLogFilter.class);
        filterLog = new ListAppender<>();
        filterLog.start();
        filterLogger.addAppender(filterLog);
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
        filterLogger.detachAppender(filterLog);
        filterLog.stop();
    }

    private AuditLogFilter filter(AuditLevel level) {
        return filter(level, new StreamAuditSink(output));
    }

    private AuditLogFilter filter(AuditLevel level, AuditSink sink) {
        AuditLogWriter writer = new AuditLogWriter(level,
                new RedactionEngine(objectMapper, RedactionPolicy.defaults()),
                new RecordAssembler(objectMapper),
                sink,
                Clock.systemUTC());
        return new AuditLogFilter(writer, auditUserResolver);
    }

    /** Reads the request body into {@code seenBody} and answers 201 with a JSON body. */
    private static FilterChain jsonHandler(AtomicReference<String> seenBody) {
        return (req, res) -> {
            seenBody.set(new String(StreamUtils.copyToByteArray(req.getInputStream()), StandardCharsets.UTF_8));
            res.setContentType(MediaType.APPLICATION_JSON_VALUE);
            ((HttpServletResponse) res).setStatus(201);
            res.getOutputStream().write(RESPONSE_JSON.getBytes(StandardCharsets.UTF_8));
        };
    }

    private JsonNode singleRecord() throws IOException {
        String out = output.toString(StandardCharsets.UTF_8);
        assertThat(out.lines().count()).isEqualTo(1);
        return objectMapper.readTree(out);
    }

    @Test
    @DisplayName("doFilter: The handler and the client see unredacted payloads, the record sees redacted ones")
    void doFilter_requestResponse() throws ServletException, IOException {
        AtomicReference<String> seenBody = new AtomicReference<>();

        filter(AuditLevel.REQUEST_RESPONSE).doFilter(request, response, jsonHandler(seenBody));

        assertThat(seenBody.get()).isEqualTo(REQUEST_JSON);
        assertThat(response.getStatus()).isEqualTo(201);
        assertThat(response.getContentAsString()).isEqualTo(RESPONSE_JSON);

        JsonNode record = singleRecord();
        assertThat(record.get("responseCode").asInt()).isEqualTo(201);
        assertThat(record.get("requestBody").get("password").asText()).isEqualTo(RedactionPolicy.REDACTED);
        assertThat(record.get("requestBody").get("user").asText()).isEqualTo("alice");
        assertThat(record.get("responseBody").get("apiKey").asText()).isEqualTo(RedactionPolicy.REDACTED);
        assertThat(record.get("responseBody").get("id").asInt()).isEqualTo(7);
    }

    @Test
    @DisplayName("doFilter: Request level records the request body but not the response body")
    void doFilter_requestLevel() throws ServletException, IOException {
        AtomicReference<String> seenBody = new AtomicReference<>();

        filter(AuditLevel.REQUEST).doFilter(request, response, jsonHandler(seenBody));

        assertThat(response.getContentAsString()).isEqualTo(RESPONSE_JSON);
        JsonNode record = singleRecord();
        assertThat(record.has("requestBody")).isTrue();
        assertThat(record.has("responseBody")).isFalse();
    }

    @Test
    @DisplayName("doFilter: The authenticated principal and its groups are recorded")
    void doFilter_recordsAuthenticatedUser() throws ServletException, IOException {
        SecurityContextHolder.getContext().setAuthentication(
                StaticTokenAuthFilter.createAuthenticationToken("alice", List.of("devs", "ops")));

        filter(AuditLevel.METADATA).doFilter(request, response, jsonHandler(new AtomicReference<>()));

        JsonNode user = singleRecord().get("user");
        assertThat(user.get("name").asText()).isEqualTo("alice");
        assertThat(user.get("group").toString()).isEqualTo("[\"devs\",\"ops\"]");
    }

    @Test
    @DisplayName("doFilter: Unauthenticated requests are recorded as the anonymous user")
    void doFilter_recordsAnonymousUser() throws ServletException, IOException {
        filter(AuditLevel.METADATA).doFilter(request, response, jsonHandler(new AtomicReference<>()));

        JsonNode user = singleRecord().get("user");
        assertThat(user.get("name").asText()).isEqualTo(AuditUserResolver.ANONYMOUS_USER);
        assertThat(user.get("group").get(0).asText()).isEqualTo(AuditUserResolver.UNAUTHENTICATED_GROUP);
    }

    @Test
    @DisplayName("doFilter: A failing handler propagates and no record is written")
    void doFilter_handlerFailure_noRecord() {
        FilterChain failing = (req, res) -> {
            throw new ServletException("handler blew up");
        };

        assertThatThrownBy(() -> filter(AuditLevel.REQUEST_RESPONSE).doFilter(request, response, failing))
                .isInstanceOf(ServletException.class)
                .hasMessage("handler blew up");
        assertThat(output.size()).isZero();
        assertThat(MDC.get(AuditLogFilter.MDC_AUDIT_ID_KEY)).isNull();
    }

    @Test
    @DisplayName("doFilter: Level None passes the original request through and writes nothing")
    void doFilter_levelNone() throws ServletException, IOException {
        AtomicReference<Object> seenRequest = new AtomicReference<>();

        filter(AuditLevel.NONE).doFilter(request, response, (req, res) -> seenRequest.set(req));

        assertThat(seenRequest.get()).isSameAs(request);
        assertThat(output.size()).isZero();
    }

    @Test
    @DisplayName("doFilter: A sink failure is logged and the response is still delivered")
    void doFilter_sinkFailureLogged() throws ServletException, IOException {
        AuditSink failing = mock(AuditSink.class);
        doThrow(new AuditWriteException("disk full")).when(failing).write(any());

        filter(AuditLevel.REQUEST_RESPONSE, failing).doFilter(request, response, jsonHandler(new AtomicReference<>()));

        assertThat(response.getContentAsString()).isEqualTo(RESPONSE_JSON);
        assertThat(filterLog.list)
                .filteredOn(event -> event.getLevel() == Level.ERROR)
                .singleElement()
                .satisfies(event -> assertThat(event.getFormattedMessage())
                        .startsWith("Failed to write audit record")
                        .contains("POST /v1/accounts")
                        .contains("disk full"));
    }

    @Test
    @DisplayName("doFilter: The audit id is in the MDC while the handler runs and removed afterwards")
    void doFilter_mdcScopedToChain() throws ServletException, IOException {
        AtomicReference<String> mdcDuringChain = new AtomicReference<>();

        filter(AuditLevel.METADATA).doFilter(request, response,
                (req, res) -> mdcDuringChain.set(MDC.get(AuditLogFilter.MDC_AUDIT_ID_KEY)));

        assertThat(mdcDuringChain.get()).isNotBlank();
        assertThat(singleRecord().get("auditID").asText()).isEqualTo(mdcDuringChain.get());
        assertThat(MDC.get(AuditLogFilter.MDC_AUDIT_ID_KEY)).isNull();
    }
}
