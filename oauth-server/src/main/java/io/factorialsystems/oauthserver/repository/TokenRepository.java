package io.factorialsystems.oauthserver.repository;

import io.factorialsystems.oauthserver.model.OAuthToken;

import java.time.OffsetDateTime;
import java.util.Optional;

public interface TokenRepository {

    void save(OAuthToken token);

    Optional<OAuthToken> findByTokenHash(String tokenHash);

    /**
     * Atomically retires a live refresh token (rotated and revoked in one step).
     *
     * @return false if the token was already rotated, revoked or expired
     */
    boolean markRotated(String tokenId, OffsetDateTime now);

    void linkRotation(String tokenId, String rotatedToId);

    boolean revoke(String tokenId, OffsetDateTime now);

    int revokeFamily(String familyId, OffsetDateTime now);

    int revokeByAuthorizationCode(String authorizationCodeId, OffsetDateTime now);

    int revokeByClient(String clientId, OffsetDateTime now);

    /**
     * Marks expired, never revoked tokens as revoked so a later sweep can delete them.
     */
    int retireExpired(OffsetDateTime now);

    /**
     * Deletes tokens that are revoked and expired before {@code cutoff}.
     */
    int deleteExpired(OffsetDateTime cutoff);
}
