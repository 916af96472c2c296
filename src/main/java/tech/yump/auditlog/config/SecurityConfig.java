package tech.yump.auditlog.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.AnonymousAuthenticationFilter;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import tech.yump.auditlog.audit.AuditLogFilter;
import tech.yump.auditlog.audit.AuditLogWriter;
import tech.yump.auditlog.auth.AuditUserResolver;
import tech.yump.auditlog.auth.StaticTokenAuthFilter;

@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
@Slf4j
public class SecurityConfig {

  private final AuditLogProperties auditLogProperties;
  private final AuditLogWriter auditLogWriter;
  private final AuditUserResolver auditUserResolver;

  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
    http
            .csrf(AbstractHttpConfigurer::disable)
            .formLogin(AbstractHttpConfigurer::disable)
            .httpBasic(AbstractHttpConfigurer::disable)
            .logout(AbstractHttpConfigurer::disable)
            .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS));

    // Not beans: Spring Boot would also register them as servlet filters outside the chain.
    // Auditing sits after authentication and wraps authorization, so denied requests are recorded.
    http.addFilterAfter(new AuditLogFilter(auditLogWriter, auditUserResolver), AnonymousAuthenticationFilter.class);

    AuditLogProperties.AuthProperties.StaticTokenAuthProperties staticTokens = auditLogProperties.auth().staticTokens();
    if (staticTokens.enabled()) {
      log.info("Configuring Spring Security for Static Bearer Token Authentication ({} mappings).",
              staticTokens.mappings().size());
      http
              .addFilterBefore(new StaticTokenAuthFilter(staticTokens), UsernamePasswordAuthenticationFilter.class)
              .authorizeHttpRequests(authz -> authz
                      .requestMatchers("/", "/sys/**").permitAll()
                      .requestMatchers("/v3/api-docs/**", "/swagger-ui/**", "/swagger-ui.html").permitAll()
                      .anyRequest().authenticated()
              );
    } else {
      log.warn("Static token authentication is disabled via configuration (audit.auth.static-tokens.enabled=false). All requests are audited as '{}'.",
              AuditUserResolver.ANONYMOUS_USER);
      http.authorizeHttpRequests(authz -> authz.anyRequest().permitAll());
    }

    return http.build();
  }
}
