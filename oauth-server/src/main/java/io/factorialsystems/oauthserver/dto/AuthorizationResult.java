package io.factorialsystems.oauthserver.dto;

/**
 * Outcome of an authorization request: either a redirect back to the client or a consent prompt.
 */
public record AuthorizationResult(String redirectUri, ConsentDescriptor consent) {

    public static AuthorizationResult redirect(String redirectUri) {
        return new AuthorizationResult(redirectUri, null);
    }

    public static AuthorizationResult consentRequired(ConsentDescriptor consent) {
        return new AuthorizationResult(null, consent);
    }

    public boolean isRedirect() {
        return redirectUri != null;
    }
}
