package io.factorialsystems.oauthserver.exception;

import org.springframework.http.HttpStatus;
import org.springframework.security.oauth2.core.OAuth2ErrorCodes;

/**
 * RFC 6749 / RFC 7591 error codes with the HTTP status each one is rendered with.
 */
public enum OAuthError {
    INVALID_REQUEST(OAuth2ErrorCodes.INVALID_REQUEST, HttpStatus.BAD_REQUEST),
    INVALID_CLIENT(OAuth2ErrorCodes.INVALID_CLIENT, HttpStatus.UNAUTHORIZED),
    INVALID_GRANT(OAuth2ErrorCodes.INVALID_GRANT, HttpStatus.BAD_REQUEST),
    UNAUTHORIZED_CLIENT(OAuth2ErrorCodes.UNAUTHORIZED_CLIENT, HttpStatus.BAD_REQUEST),
    UNSUPPORTED_GRANT_TYPE(OAuth2ErrorCodes.UNSUPPORTED_GRANT_TYPE, HttpStatus.BAD_REQUEST),
    UNSUPPORTED_RESPONSE_TYPE(OAuth2ErrorCodes.UNSUPPORTED_RESPONSE_TYPE, HttpStatus.BAD_REQUEST),
    INVALID_SCOPE(OAuth2ErrorCodes.INVALID_SCOPE, HttpStatus.BAD_REQUEST),
    ACCESS_DENIED(OAuth2ErrorCodes.ACCESS_DENIED, HttpStatus.FORBIDDEN),
    INVALID_TOKEN(OAuth2ErrorCodes.INVALID_TOKEN, HttpStatus.UNAUTHORIZED),
    INVALID_REDIRECT_URI(OAuth2ErrorCodes.INVALID_REDIRECT_URI, HttpStatus.BAD_REQUEST),
    INVALID_CLIENT_METADATA("invalid_client_metadata", HttpStatus.BAD_REQUEST),
    SERVER_ERROR(OAuth2ErrorCodes.SERVER_ERROR, HttpStatus.INTERNAL_SERVER_ERROR);

    private final String code;
    private final HttpStatus status;

    OAuthError(String code, HttpStatus status) {
        this.code = code;
        this.status = status;
    }

    public String getCode() {
        return code;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
