package tech.yump.auditlog.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import tech.yump.auditlog.audit.AuditLevel;
import tech.yump.auditlog.audit.RedactionPolicy;

import java.util.Collections;
import java.util.List;
import java.util.regex.PatternSyntaxException;

/**
 * Configuration properties for the audit trail under the 'audit' prefix.
 */
@ConfigurationProperties(prefix = "audit")
@Validated
public record AuditLogProperties(

        AuditLevel level,

        @NotBlank(message = "Sensitive key pattern (audit.sensitive-key-pattern) must not be blank.")
        String sensitiveKeyPattern,

        @NotEmpty(message = "At least one secret path marker (audit.secret-path-markers) must be provided.")
        List<String> secretPathMarkers,

        @Valid
        SinkProperties sink,

        @Valid
        AuthProperties auth
) {
    public AuditLogProperties {
        if (level == null) {
            level = AuditLevel.METADATA;
        }
        if (sensitiveKeyPattern == null) {
            sensitiveKeyPattern = RedactionPolicy.DEFAULT_SENSITIVE_KEY_PATTERN;
        }
        if (secretPathMarkers == null) {
            secretPathMarkers = RedactionPolicy.DEFAULT_SECRET_PATH_MARKERS;
        }
        if (sink == null) {
            sink = new SinkProperties(null, null);
        }
        if (auth == null) {
            auth = new AuthProperties(null);
        }
    }

    @AssertTrue(message = "Sensitive key pattern (audit.sensitive-key-pattern) must be a valid regular expression.")
    public boolean isSensitiveKeyPatternValid() {
        if (sensitiveKeyPattern == null || sensitiveKeyPattern.isBlank()) {
            return true; // reported by @NotBlank
        }
        try {
            java.util.regex.Pattern.compile(sensitiveKeyPattern);
            return true;
        } catch (PatternSyntaxException e) {
            return false;
        }
    }

    public RedactionPolicy redactionPolicy() {
        return RedactionPolicy.of(sensitiveKeyPattern, secretPathMarkers);
    }

    // --- SinkProperties ---
    @Validated
    public record SinkProperties(
            @Pattern(regexp = "slf4j|file|stdout", message = "Audit sink type (audit.sink.type) must be one of: slf4j, file, stdout.")
            String type,

            String path
    ) {
        public static final String TYPE_PROPERTY = "audit.sink.type";
        public static final String PATH_PROPERTY = "audit.sink.path";

        public SinkProperties {
            if (type == null) {
                type = "slf4j";
            }
            if (path == null) {
                path = "logs/audit.log";
            }
        }
    }

    @Validated
    public record AuthProperties(
            @Valid
            StaticTokenAuthProperties staticTokens
    ) {
        public AuthProperties {
            if (staticTokens == null) {
                staticTokens = new StaticTokenAuthProperties(false, null);
            }
        }

        @Validated
        public record StaticTokenUserMapping(
                @NotBlank(message = "Static token value cannot be blank")
                String token,

                @NotBlank(message = "Static token must be associated with a user name")
                String user,

                List<String> groups
        ) {
            public StaticTokenUserMapping {
                if (groups == null) {
                    groups = Collections.emptyList();
                }
            }

            @Override
            public String toString() {
                // Avoid logging the token in toString()
                return "StaticTokenUserMapping[token=******, user='" + user + "', groups=" + groups + ']';
            }
        }

        /**
         * Properties specific to static bearer token authentication.
         * Validation ensures mappings are present if enabled.
         */
        @Validated
        public record StaticTokenAuthProperties(
                boolean enabled,

                @Valid
                List<StaticTokenUserMapping> mappings
        ) {
            public StaticTokenAuthProperties {
                if (mappings == null) {
                    mappings = Collections.emptyList();
                }
            }

            @AssertTrue(message = "Static token mappings (audit.auth.static-tokens.mappings) cannot be empty when static token auth is enabled.")
            public boolean isMappingsValid() {
                return !this.enabled() || (this.mappings() != null && !this.mappings().isEmpty());
            }
        }
    }
}
