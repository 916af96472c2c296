package tech.yump.auditlog.audit;

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.util.Objects;

/**
 * An AuditSink implementation writing raw record lines to an {@link OutputStream}.
 * Writes are serialized on the sink so each record lands as one contiguous line.
 * A {@link PrintStream} such as {@code System.out} reports failures through its error flag,
 * which is checked after every write.
 */
public class StreamAuditSink implements AuditSink {

    private final OutputStream output;
    private final Object lock = new Object();

    public StreamAuditSink(OutputStream output) {
        this.output = Objects.requireNonNull(output, "output");
    }

    @Override
    public void write(byte[] line) {
        synchronized (lock) {
            try {
                output.write(line);
                output.flush();
            } catch (IOException e) {
                throw new AuditWriteException("Failed to write audit record to output stream", e);
            }
            if (output instanceof PrintStream && ((PrintStream) output).checkError()) {
                throw new AuditWriteException("Failed to write audit record to output stream: print stream is in error state");
            }
        }
    }
}
