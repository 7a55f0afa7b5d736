package io.factorialsystems.oauthserver.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Grant types accepted at the token endpoint. Adding a constant here forces every
 * exhaustive switch over grants to handle it.
 */
public enum GrantType {
    AUTHORIZATION_CODE("authorization_code"),
    CLIENT_CREDENTIALS("client_credentials"),
    REFRESH_TOKEN("refresh_token");

    private final String value;

    GrantType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<GrantType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(grantType -> grantType.value.equals(value))
                .findFirst();
    }
}
