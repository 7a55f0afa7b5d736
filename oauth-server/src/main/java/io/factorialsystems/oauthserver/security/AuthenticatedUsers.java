package io.factorialsystems.oauthserver.security;

import org.springframework.security.core.Authentication;

public final class AuthenticatedUsers {

    private AuthenticatedUsers() {
    }

    /**
     * Platform user id of the logged-in user, or null when there is none.
     */
    public static String userId(Authentication authentication) {
        if (authentication == null || !authentication.isAuthenticated()) {
            return null;
        }
        if (authentication.getPrincipal() instanceof DatabaseUserDetailsService.CustomUserPrincipal principal) {
            return principal.getUserId();
        }
        return authentication.getName();
    }
}
