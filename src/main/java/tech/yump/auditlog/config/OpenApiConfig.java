package tech.yump.auditlog.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    // Logical name for the security scheme within the OpenAPI document
    public static final String SECURITY_SCHEME_NAME = "BearerTokenAuth";

    @Bean
    public OpenAPI customOpenAPI() {
        SecurityScheme bearerScheme = new SecurityScheme()
                .type(SecurityScheme.Type.HTTP)
                .scheme("bearer")
                .description("Static bearer token mapped to a user and groups in audit.auth.static-tokens. "
                        + "The resolved identity is attached to every audit record.");

        return new OpenAPI()
                .info(new Info()
                        .title("LiteAudit API")
                        .description("HTTP audit trail with sensitive payload redaction"))
                .components(new Components()
                        .addSecuritySchemes(SECURITY_SCHEME_NAME, bearerScheme))
                // Operations opt out with security = {}
                .addSecurityItem(new SecurityRequirement().addList(SECURITY_SCHEME_NAME));
    }
}
