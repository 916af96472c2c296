package tech.yump.auditlog.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;

import java.util.List;
import java.util.Map;

/**
 * Fixed fields of one audit log entry. Request and response bodies are not part of
 * this type; {@link RecordAssembler} embeds them as raw JSON after serialization.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY) // Absent fields are omitted, never written as null
@JsonPropertyOrder({
        "auditID", "requestURI", "user", "method", "remoteAddr",
        "requestTimestamp", "responseTimestamp", "responseCode",
        "requestHeader", "responseHeader"
})
public record AuditRecord(
        @JsonProperty("auditID") String auditId,
        String requestURI,
        AuditUser user,
        String method,
        String remoteAddr,
        String requestTimestamp,  // RFC 3339
        String responseTimestamp, // RFC 3339
        Integer responseCode,
        Map<String, List<String>> requestHeader,
        Map<String, List<String>> responseHeader
) {
}
