package tech.yump.auditlog.audit;

import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Jackson setup shared by the redaction and assembly passes.
 */
final class AuditJson {

    /**
     * Deepest body nesting that is redacted and recorded. Assembly allows one more level for the
     * enclosing record object.
     */
    static final int MAX_BODY_NESTING_DEPTH = 2048;

    private AuditJson() {
    }

    /**
     * Copy of {@code source} whose parsers accept bodies nested up to {@code maxNestingDepth}, with no
     * string or number length limit. Bodies are already held in memory when they are parsed.
     */
    static ObjectMapper withReadLimits(ObjectMapper source, int maxNestingDepth) {
        ObjectMapper copy = source.copy();
        copy.getFactory().setStreamReadConstraints(StreamReadConstraints.builder()
                .maxNestingDepth(maxNestingDepth)
                .maxStringLength(Integer.MAX_VALUE)
                .maxNumberLength(Integer.MAX_VALUE)
                .build());
        return copy;
    }
}
