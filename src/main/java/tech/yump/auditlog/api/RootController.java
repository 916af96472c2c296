package tech.yump.auditlog.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.auditlog.config.AuditLogProperties;

import java.util.Map;

@RestController
@Tag(name = "System", description = "System information and audit status endpoints")
public class RootController {

  private final AuditLogProperties auditLogProperties;

  public RootController(AuditLogProperties auditLogProperties) {
    this.auditLogProperties = auditLogProperties;
  }

  @GetMapping("/")
  @Operation(
          summary = "Root Endpoint",
          description = "Provides a simple welcome message and status check. Does not require authentication.",
          security = {}
  )
  @ApiResponse(responseCode = "200", description = "Welcome message and status.",
          content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                  schema = @Schema(type = "object", example = "{\"message\": \"Welcome to LiteAudit API\", \"status\": \"OK\"}")))
  public Map<String, String> getRoot() {
    return Map.of("message", "Welcome to LiteAudit API", "status", "OK");
  }

  @GetMapping("/sys/audit-status")
  @Operation(
          summary = "Get Audit Status",
          description = "Returns the configured audit level and sink type. Does not require authentication.",
          security = {}
  )
  @ApiResponse(responseCode = "200", description = "Audit configuration retrieved.",
          content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                  schema = @Schema(type = "object", example = "{\"level\": \"Metadata\", \"sink\": \"slf4j\"}")))
  public Map<String, String> getAuditStatus() {
    return Map.of(
            "level", auditLogProperties.level().displayName(),
            "sink", auditLogProperties.sink().type());
  }
}
