package tech.yump.auditlog.audit;

/**
 * Destination for completed audit records.
 * Defines the contract for appending one serialized record.
 */
public interface AuditSink {

    /**
     * Appends one record. Implementations must write the line as a single unit so that
     * records from concurrent requests never interleave.
     *
     * @param line one compact JSON object terminated by a newline. Must not be null.
     * @throws AuditWriteException if the record could not be written.
     */
    void write(byte[] line);

}
