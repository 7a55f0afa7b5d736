package io.factorialsystems.oauthserver.exception;

import lombok.Getter;

/**
 * Protocol-level failure returned to the caller as an {@code {error, error_description}} pair.
 * The description is client-facing and must never carry internal detail.
 */
@Getter
public class OAuthException extends RuntimeException {

    private final OAuthError error;
    private final String description;

    public OAuthException(OAuthError error, String description) {
        super(error.getCode() + ": " + description);
        this.error = error;
        this.description = description;
    }

    public OAuthException(OAuthError error, String description, Throwable cause) {
        super(error.getCode() + ": " + description, cause);
        this.error = error;
        this.description = description;
    }

    public static OAuthException invalidRequest(String description) {
        return new OAuthException(OAuthError.INVALID_REQUEST, description);
    }

    /**
     * Always the same description, whatever the actual reason, so callers cannot probe
     * which part of the credential check failed.
     */
    public static OAuthException invalidClient() {
        return new OAuthException(OAuthError.INVALID_CLIENT, "Client authentication failed");
    }

    public static OAuthException invalidGrant(String description) {
        return new OAuthException(OAuthError.INVALID_GRANT, description);
    }

    public static OAuthException unauthorizedClient(String description) {
        return new OAuthException(OAuthError.UNAUTHORIZED_CLIENT, description);
    }

    public static OAuthException unsupportedGrantType(String grantType) {
        return new OAuthException(OAuthError.UNSUPPORTED_GRANT_TYPE,
                "Grant type '" + grantType + "' is not supported");
    }

    public static OAuthException invalidScope(String description) {
        return new OAuthException(OAuthError.INVALID_SCOPE, description);
    }

    public static OAuthException accessDenied(String description) {
        return new OAuthException(OAuthError.ACCESS_DENIED, description);
    }

    public static OAuthException invalidToken(String description) {
        return new OAuthException(OAuthError.INVALID_TOKEN, description);
    }

    public static OAuthException invalidRedirectUri(String description) {
        return new OAuthException(OAuthError.INVALID_REDIRECT_URI, description);
    }

    public static OAuthException invalidClientMetadata(String description) {
        return new OAuthException(OAuthError.INVALID_CLIENT_METADATA, description);
    }

    public static OAuthException serverError(Throwable cause) {
        return new OAuthException(OAuthError.SERVER_ERROR, "The authorization server encountered an unexpected error", cause);
    }
}
