package tech.yump.auditlog.audit;

import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;

/**
 * An AuditSink implementation that logs audit records as JSON strings
 * to the configured SLF4j logger (typically at INFO level).
 */
@Slf4j
public class LogAuditSink implements AuditSink {

    @Override
    public void write(byte[] line) {
        log.info("AUDIT_EVENT: {}", toJson(line));
    }

    static String toJson(byte[] line) {
        int length = line.length;
        if (length > 0 && line[length - 1] == '\n') {
            length--; // the logging pattern supplies its own line separator
        }
        return new String(line, 0, length, StandardCharsets.UTF_8);
    }
}
