package io.factorialsystems.oauthserver.model;

import java.util.Arrays;
import java.util.Optional;

public enum TokenType {
    ACCESS_TOKEN("access_token"),
    REFRESH_TOKEN("refresh_token");

    private final String hint;

    TokenType(String hint) {
        this.hint = hint;
    }

    /**
     * Value used by the {@code token_type_hint} parameter (RFC 7009 / RFC 7662).
     */
    public String getHint() {
        return hint;
    }

    public static Optional<TokenType> fromHint(String hint) {
        if (hint == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.hint.equals(hint))
                .findFirst();
    }
}
