package tech.yump.auditlog.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An AuditSink implementation that writes audit records to a dedicated audit log file
 * configured via Logback. The audit logger has additivity disabled, so records reach
 * only the audit file and never the application log.
 */
public class FileAuditSink implements AuditSink {

    // The specific logger name configured in logback-spring.xml for audit records
    public static final String AUDIT_LOGGER_NAME = "tech.yump.auditlog.audit.FILE_AUDIT";
    private static final Logger auditLogger = LoggerFactory.getLogger(AUDIT_LOGGER_NAME);

    @Override
    public void write(byte[] line) {
        auditLogger.info(LogAuditSink.toJson(line));
    }
}
