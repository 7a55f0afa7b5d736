package io.factorialsystems.oauthserver.model;

import lombok.*;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ToString(exclude = "codeHash")
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class AuthorizationCode {
    private String id;
    private String codeHash;
    private String clientId;
    private String userId;
    private String redirectUri;

    @Builder.Default
    private List<String> scopes = new ArrayList<>();

    private String codeChallenge;
    private String codeChallengeMethod;
    private OffsetDateTime issuedAt;
    private OffsetDateTime expiresAt;
    private OffsetDateTime consumedAt;

    public boolean isExpired(OffsetDateTime now) {
        return !now.isBefore(expiresAt);
    }

    /**
     * True once the code was exchanged. Codes retired by the cleanup sweep carry a stamp at or
     * after expiry and count as expired, not consumed.
     */
    public boolean isConsumed() {
        return consumedAt != null && consumedAt.isBefore(expiresAt);
    }

    public boolean hasCodeChallenge() {
        return codeChallenge != null && !codeChallenge.isEmpty();
    }
}
