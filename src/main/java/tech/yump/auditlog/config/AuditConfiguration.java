package tech.yump.auditlog.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import tech.yump.auditlog.audit.AuditLogWriter;
import tech.yump.auditlog.audit.AuditSink;
import tech.yump.auditlog.audit.FileAuditSink;
import tech.yump.auditlog.audit.LogAuditSink;
import tech.yump.auditlog.audit.RecordAssembler;
import tech.yump.auditlog.audit.RedactionEngine;
import tech.yump.auditlog.audit.RedactionPolicy;
import tech.yump.auditlog.audit.StreamAuditSink;

import java.time.Clock;

@Configuration
@Slf4j
public class AuditConfiguration {

    // Profile that activates the audit file appender in logback-spring.xml
    public static final String AUDIT_FILE_PROFILE = "audit-file";

    // Inject the globally configured ObjectMapper
    private final ObjectMapper objectMapper;
    private final AuditLogProperties auditLogProperties;
    private final Environment environment;

    public AuditConfiguration(ObjectMapper objectMapper, AuditLogProperties auditLogProperties, Environment environment) {
        this.objectMapper = objectMapper;
        this.auditLogProperties = auditLogProperties;
        this.environment = environment;
    }

    @Bean
    @ConditionalOnProperty(name = AuditLogProperties.SinkProperties.TYPE_PROPERTY, havingValue = "slf4j", matchIfMissing = true)
    public AuditSink logAuditSink() {
        log.info("Configuring SLF4j Audit Sink");
        return new LogAuditSink();
    }

    @Bean
    @ConditionalOnProperty(name = AuditLogProperties.SinkProperties.TYPE_PROPERTY, havingValue = "file")
    public AuditSink fileAuditSink() {
        log.info("Configuring File Audit Sink. Ensure Logback is configured correctly for logger '{}' and path property '{}' ({}).",
                FileAuditSink.AUDIT_LOGGER_NAME, AuditLogProperties.SinkProperties.PATH_PROPERTY,
                auditLogProperties.sink().path());
        if (!environment.acceptsProfiles(Profiles.of(AUDIT_FILE_PROFILE))) {
            log.warn("Audit sink type is 'file' but profile '{}' is not active. Logger '{}' has no file appender and audit records will reach the application log instead of '{}'.",
                    AUDIT_FILE_PROFILE, FileAuditSink.AUDIT_LOGGER_NAME, auditLogProperties.sink().path());
        }
        return new FileAuditSink();
    }

    @Bean
    @ConditionalOnProperty(name = AuditLogProperties.SinkProperties.TYPE_PROPERTY, havingValue = "stdout")
    public AuditSink streamAuditSink() {
        log.info("Configuring stdout Audit Sink");
        return new StreamAuditSink(System.out);
    }

    @Bean
    public RedactionPolicy redactionPolicy() {
        RedactionPolicy policy = auditLogProperties.redactionPolicy();
        log.info("Audit redaction: sensitive key pattern '{}', secret path markers {}",
                policy.sensitiveKeyPattern().pattern(), policy.secretPathMarkers());
        return policy;
    }

    @Bean
    public RedactionEngine redactionEngine(RedactionPolicy redactionPolicy) {
        return new RedactionEngine(objectMapper, redactionPolicy);
    }

    @Bean
    public RecordAssembler recordAssembler() {
        return new RecordAssembler(objectMapper);
    }

    @Bean
    public Clock auditClock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public AuditLogWriter auditLogWriter(AuditSink auditSink, RedactionEngine redactionEngine,
                                         RecordAssembler recordAssembler, Clock auditClock) {
        log.info("Audit trail level: {}", auditLogProperties.level());
        return new AuditLogWriter(auditLogProperties.level(), redactionEngine, recordAssembler, auditSink, auditClock);
    }
}
