package tech.yump.auditlog.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;

import java.util.List;

/**
 * The identity attached to an audit record.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"name", "group", "requestUser", "requestGroups"})
public record AuditUser(
        String name,
        List<String> group,
        String requestUser,       // impersonated user (Impersonate-User)
        List<String> requestGroups // impersonated groups (Impersonate-Group)
) {
}
