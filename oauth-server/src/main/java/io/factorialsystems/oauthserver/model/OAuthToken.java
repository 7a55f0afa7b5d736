package io.factorialsystems.oauthserver.model;

import lombok.*;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Access or refresh token. Every token minted for one grant shares a {@code familyId};
 * refresh tokens are chained through {@code rotatedFromId}/{@code rotatedToId}.
 */
@Getter
@Setter
@ToString(exclude = "tokenHash")
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class OAuthToken {
    private String id;
    private String tokenHash;
    private TokenType tokenType;
    private String clientId;
    private String userId;

    @Builder.Default
    private List<String> scopes = new ArrayList<>();

    private String familyId;
    private String authorizationCodeId;
    private String rotatedFromId;
    private String rotatedToId;
    private OffsetDateTime issuedAt;
    private OffsetDateTime expiresAt;
    private OffsetDateTime revokedAt;
    private OffsetDateTime rotatedAt;

    public boolean isExpired(OffsetDateTime now) {
        return !now.isBefore(expiresAt);
    }

    public boolean isRevoked() {
        return revokedAt != null;
    }

    public boolean isRotated() {
        return rotatedAt != null;
    }

    public boolean isActive(OffsetDateTime now) {
        return !isRevoked() && !isRotated() && !isExpired(now);
    }

    public boolean isRefreshToken() {
        return tokenType == TokenType.REFRESH_TOKEN;
    }
}
