package tech.yump.auditlog.auth;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;
import tech.yump.auditlog.config.AuditLogProperties.AuthProperties.StaticTokenAuthProperties;
import tech.yump.auditlog.config.AuditLogProperties.AuthProperties.StaticTokenUserMapping;

import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Authenticates {@code Authorization: Bearer <token>} requests against the configured static
 * token mappings. A matching token installs a principal named after the mapped user, with one
 * {@code GROUP_<name>} authority per mapped group.
 */
@Slf4j
public class StaticTokenAuthFilter extends OncePerRequestFilter {

  public static final String BEARER_PREFIX = "Bearer ";
  public static final String GROUP_AUTHORITY_PREFIX = "GROUP_";

  private final boolean staticAuthEnabled;
  private final List<StaticTokenUserMapping> tokenMappings;

  public StaticTokenAuthFilter(StaticTokenAuthProperties staticTokenProps) {
    this.staticAuthEnabled = Optional.ofNullable(staticTokenProps)
            .map(StaticTokenAuthProperties::enabled)
            .orElse(false);

    this.tokenMappings = Optional.ofNullable(staticTokenProps)
            .map(StaticTokenAuthProperties::mappings)
            .orElse(Collections.emptyList());

    log.debug("StaticTokenAuthFilter initialized. Enabled: {}, Mappings count: {}",
            this.staticAuthEnabled, this.tokenMappings.size());
    if (this.staticAuthEnabled && this.tokenMappings.isEmpty()) {
      log.warn("Static token authentication is enabled but no token mappings are configured!");
    }
  }

  public static UsernamePasswordAuthenticationToken createAuthenticationToken(String user, List<String> groups) {
    List<GrantedAuthority> authorities = groups.stream()
            .map(group -> (GrantedAuthority) new SimpleGrantedAuthority(GROUP_AUTHORITY_PREFIX + group))
            .toList();
    return new UsernamePasswordAuthenticationToken(user, null, authorities);
  }

  @Override
  protected void doFilterInternal(
          @NonNull HttpServletRequest request,
          @NonNull HttpServletResponse response,
          @NonNull FilterChain filterChain) throws ServletException, IOException {

    Optional<String> bearerToken = extractBearerToken(request);
    if (bearerToken.isEmpty() || SecurityContextHolder.getContext().getAuthentication() != null) {
      log.trace("No bearer token found or authentication already present for {}. Proceeding.",
              request.getRequestURI());
      filterChain.doFilter(request, response);
      return;
    }

    final String providedToken = bearerToken.get();
    Optional<StaticTokenUserMapping> mappingOptional = tokenMappings.stream()
            .filter(mapping -> providedToken.equals(mapping.token()))
            .findFirst();

    if (mappingOptional.isPresent()) {
      StaticTokenUserMapping mapping = mappingOptional.get();
      UsernamePasswordAuthenticationToken authentication = createAuthenticationToken(mapping.user(), mapping.groups());
      authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
      SecurityContextHolder.getContext().setAuthentication(authentication);
      log.debug("Authenticated user '{}' with groups {} for URI: {}",
              mapping.user(), mapping.groups(), request.getRequestURI());
    } else {
      // Proceed unauthenticated; authorization rejects the request later
      log.warn("Invalid or unknown bearer token received for URI: {}", request.getRequestURI());
    }

    filterChain.doFilter(request, response);
  }

  @Override
  protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
    if (!staticAuthEnabled) {
      log.trace("Skipping filter as static auth is disabled.");
      return true;
    }
    return false;
  }

  private static Optional<String> extractBearerToken(HttpServletRequest request) {
    String header = request.getHeader(HttpHeaders.AUTHORIZATION);
    if (!StringUtils.hasText(header) || !header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
      return Optional.empty();
    }
    String token = header.substring(BEARER_PREFIX.length()).trim();
    return token.isEmpty() ? Optional.empty() : Optional.of(token);
  }
}
