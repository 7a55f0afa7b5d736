package io.factorialsystems.oauthserver.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * How a client authenticates at the token, introspection and revocation endpoints.
 */
public enum TokenEndpointAuthMethod {
    CLIENT_SECRET_BASIC("client_secret_basic"),
    CLIENT_SECRET_POST("client_secret_post"),
    NONE("none");

    private final String value;

    TokenEndpointAuthMethod(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<TokenEndpointAuthMethod> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(method -> method.value.equals(value))
                .findFirst();
    }
}
