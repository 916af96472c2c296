package tech.yump.auditlog.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.validation.BindValidationException;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Import;
import tech.yump.auditlog.audit.AuditLevel;
import tech.yump.auditlog.audit.RedactionPolicy;

import static org.assertj.core.api.Assertions.assertThat;

public class ConfigurationValidationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ValidationAutoConfiguration.class))
            .withUserConfiguration(TestConfig.class);

    @EnableConfigurationProperties(AuditLogProperties.class)
    @Import(AuditLevelConverter.class)
    static class TestConfig {}

    @Test
    @DisplayName("Config Validation: Should PASS with defaults when nothing is configured")
    void validate_defaults_shouldPass() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            AuditLogProperties props = context.getBean(AuditLogProperties.class);
            assertThat(props.level()).isEqualTo(AuditLevel.METADATA);
            assertThat(props.sensitiveKeyPattern()).isEqualTo(RedactionPolicy.DEFAULT_SENSITIVE_KEY_PATTERN);
            assertThat(props.secretPathMarkers()).containsExactly("secrets");
            assertThat(props.sink().type()).isEqualTo("slf4j");
            assertThat(props.sink().path()).isEqualTo("logs/audit.log");
            assertThat(props.auth().staticTokens().enabled()).isFalse();
            assertThat(props.auth().staticTokens().mappings()).isEmpty();
        });
    }

    @Test
    @DisplayName("Config Validation: Should bind the level from its name")
    void validateLevel_byName_shouldPass() {
        contextRunner
                .withPropertyValues("audit.level=RequestResponse")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context.getBean(AuditLogProperties.class).level()).isEqualTo(AuditLevel.REQUEST_RESPONSE);
                });
    }

    @Test
    @DisplayName("Config Validation: Should bind the level from its numeric value")
    void validateLevel_byNumber_shouldPass() {
        contextRunner
                .withPropertyValues("audit.level=2")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context.getBean(AuditLogProperties.class).level()).isEqualTo(AuditLevel.REQUEST);
                });
    }

    @Test
    @DisplayName("Config Validation: Should FAIL when the level is unknown")
    void validateLevel_unknown_shouldFail() {
        contextRunner
                .withPropertyValues("audit.level=Everything")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .rootCause()
                            .hasMessageContaining("Unknown audit level: Everything");
                });
    }

    @Test
    @DisplayName("Config Validation: Should FAIL when the sensitive key pattern is not a valid regex")
    void validatePattern_invalidRegex_shouldFail() {
        contextRunner
                .withPropertyValues("audit.sensitive-key-pattern=(password")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .hasRootCauseInstanceOf(BindValidationException.class)
                            .rootCause()
                            .hasMessageContaining("Sensitive key pattern (audit.sensitive-key-pattern) must be a valid regular expression.");
                });
    }

    @Test
    @DisplayName("Config Validation: Should PASS with a custom pattern and markers")
    void validatePattern_custom_shouldPass() {
        contextRunner
                .withPropertyValues(
                        "audit.sensitive-key-pattern=(?i)ssn",
                        "audit.secret-path-markers[0]=secrets",
                        "audit.secret-path-markers[1]=vault"
                )
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    RedactionPolicy policy = context.getBean(AuditLogProperties.class).redactionPolicy();
                    assertThat(policy.isSensitiveKey("customerSSN")).isTrue();
                    assertThat(policy.isSensitiveKey("password")).isFalse();
                    assertThat(policy.isSecretPath("/api/vault/items")).isTrue();
                });
    }

    @Test
    @DisplayName("Config Validation: Should FAIL when the sink type is unknown")
    void validateSink_unknownType_shouldFail() {
        contextRunner
                .withPropertyValues("audit.sink.type=kafka")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .hasRootCauseInstanceOf(BindValidationException.class)
                            .rootCause()
                            .hasMessageContaining("Audit sink type (audit.sink.type) must be one of: slf4j, file, stdout.");
                });
    }

    @Test
    @DisplayName("Config Validation: Should FAIL when static auth enabled but mappings are empty")
    void validateStaticTokens_enabledTrue_mappingsEmpty_shouldFail() {
        contextRunner
                .withPropertyValues(
                        "audit.auth.static-tokens.enabled=true",
                        "audit.auth.static-tokens.mappings="
                )
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .hasRootCauseInstanceOf(BindValidationException.class)
                            .rootCause()
                            .hasMessageContaining("Static token mappings (audit.auth.static-tokens.mappings) cannot be empty when static token auth is enabled.");
                });
    }

    @Test
    @DisplayName("Config Validation: Should FAIL when a mapping has no user")
    void validateStaticTokens_mappingWithoutUser_shouldFail() {
        contextRunner
                .withPropertyValues(
                        "audit.auth.static-tokens.enabled=true",
                        "audit.auth.static-tokens.mappings[0].token=t-1"
                )
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .hasRootCauseInstanceOf(BindValidationException.class)
                            .rootCause()
                            .hasMessageContaining("Static token must be associated with a user name");
                });
    }

    @Test
    @DisplayName("Config Validation: Should PASS when static auth enabled and mappings are present")
    void validateStaticTokens_enabledTrue_mappingsPresent_shouldPass() {
        contextRunner
                .withPropertyValues(
                        "audit.auth.static-tokens.enabled=true",
                        "audit.auth.static-tokens.mappings[0].token=t-1",
                        "audit.auth.static-tokens.mappings[0].user=alice",
                        "audit.auth.static-tokens.mappings[0].groups[0]=devs"
                )
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    AuditLogProperties props = context.getBean(AuditLogProperties.class);
                    assertThat(props.auth().staticTokens().mappings()).singleElement()
                            .satisfies(mapping -> {
                                assertThat(mapping.user()).isEqualTo("alice");
                                assertThat(mapping.groups()).containsExactly("devs");
                                assertThat(mapping.toString()).doesNotContain("t-1");
                            });
                });
    }
}
