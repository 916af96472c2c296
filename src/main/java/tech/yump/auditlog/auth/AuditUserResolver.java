package tech.yump.auditlog.auth;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.lang.Nullable;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.stereotype.Component;
import tech.yump.auditlog.audit.AuditUser;

import java.util.Collections;
import java.util.Enumeration;
import java.util.List;

/**
 * Builds the {@link AuditUser} of a request from its {@link Authentication} and the
 * impersonation headers the caller sent.
 */
@Component
public class AuditUserResolver {

    public static final String IMPERSONATE_USER_HEADER = "Impersonate-User";
    public static final String IMPERSONATE_GROUP_HEADER = "Impersonate-Group";

    public static final String ANONYMOUS_USER = "system:anonymous";
    public static final String UNAUTHENTICATED_GROUP = "system:unauthenticated";

    public AuditUser resolve(@Nullable Authentication authentication, @Nullable HttpServletRequest request) {
        AuditUser.AuditUserBuilder builder = AuditUser.builder();

        if (isAuthenticated(authentication)) {
            builder.name(authentication.getName())
                    .group(extractGroups(authentication));
        } else {
            builder.name(ANONYMOUS_USER)
                    .group(List.of(UNAUTHENTICATED_GROUP));
        }

        if (request != null) {
            builder.requestUser(request.getHeader(IMPERSONATE_USER_HEADER));
            Enumeration<String> impersonatedGroups = request.getHeaders(IMPERSONATE_GROUP_HEADER);
            if (impersonatedGroups != null && impersonatedGroups.hasMoreElements()) {
                builder.requestGroups(Collections.list(impersonatedGroups));
            }
        }
        return builder.build();
    }

    private static boolean isAuthenticated(@Nullable Authentication authentication) {
        return authentication != null
                && authentication.isAuthenticated()
                && !(authentication instanceof AnonymousAuthenticationToken);
    }

    private static List<String> extractGroups(Authentication authentication) {
        return authentication.getAuthorities().stream()
                .map(GrantedAuthority::getAuthority)
                .filter(a -> a.startsWith(StaticTokenAuthFilter.GROUP_AUTHORITY_PREFIX))
                .map(a -> a.substring(StaticTokenAuthFilter.GROUP_AUTHORITY_PREFIX.length()))
                .toList();
    }
}
