package tech.yump.auditlog.audit;

/**
 * Raised when an audit record cannot be produced or delivered: serialization,
 * compaction of the assembled line, or the sink write itself. Nothing is written
 * for the session that raised it.
 */
public class AuditWriteException extends RuntimeException {

  public AuditWriteException(String message) {
    super(message);
  }

  public AuditWriteException(String message, Throwable cause) {
    super(message, cause);
  }
}
