package io.factorialsystems.oauthserver.service;

import io.factorialsystems.oauthserver.config.OAuthServerProperties;
import io.factorialsystems.oauthserver.dto.ConsumedAuthorizationCode;
import io.factorialsystems.oauthserver.dto.TokenResponse;
import io.factorialsystems.oauthserver.exception.OAuthException;
import io.factorialsystems.oauthserver.model.*;
import io.factorialsystems.oauthserver.repository.TokenRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Mints access and refresh tokens for the three supported grants and rotates refresh tokens.
 * Callers pass an already authenticated client that is allowed the grant.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TokenIssuer {

    private final CodeIssuer codeIssuer;
    private final TokenRepository tokenRepository;
    private final SecureTokenGenerator tokenGenerator;
    private final OAuthServerProperties properties;
    private final AuditSink auditSink;
    private final Clock clock;

    @Transactional(noRollbackFor = OAuthException.class)
    public TokenResponse issueForAuthCode(OAuthClient client, String code, String redirectUri, String codeVerifier) {
        ConsumedAuthorizationCode consumed = codeIssuer.consume(code, client, redirectUri, codeVerifier);
        OffsetDateTime now = OffsetDateTime.now(clock);
        String familyId = UUID.randomUUID().toString();

        String accessToken = tokenGenerator.generateToken();
        save(TokenType.ACCESS_TOKEN, accessToken, client, consumed.userId(), consumed.scopes(), familyId,
                consumed.codeId(), null, now);

        String refreshToken = null;
        if (client.supportsGrant(GrantType.REFRESH_TOKEN)) {
            refreshToken = tokenGenerator.generateToken();
            save(TokenType.REFRESH_TOKEN, refreshToken, client, consumed.userId(), consumed.scopes(), familyId,
                    consumed.codeId(), null, now);
        }

        log.info("Issued tokens for client {} and user {} from authorization code {}",
                client.getClientId(), consumed.userId(), consumed.codeId());
        auditSink.record(AuditEvent.tokenIssued(client.getClientId(), consumed.userId(),
                GrantType.AUTHORIZATION_CODE, consumed.scopes()));

        return response(accessToken, refreshToken, consumed.scopes());
    }

    @Transactional
    public TokenResponse issueForClientCredentials(OAuthClient client, String requestedScope) {
        Set<String> requested = Scopes.parse(requestedScope);
        List<String> granted;

        if (requested.isEmpty()) {
            granted = new ArrayList<>(client.getScopes());
        } else {
            granted = Scopes.intersect(requested, client.getScopes());
            if (granted.isEmpty()) {
                log.warn("Client {} requested scopes {} outside its allowed scopes", client.getClientId(), requested);
                throw OAuthException.invalidScope("None of the requested scopes are allowed for this client");
            }
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        String accessToken = tokenGenerator.generateToken();
        save(TokenType.ACCESS_TOKEN, accessToken, client, null, granted, UUID.randomUUID().toString(), null, null, now);

        log.info("Issued client credentials token for client {} with scope '{}'", client.getClientId(), Scopes.format(granted));
        auditSink.record(AuditEvent.tokenIssued(client.getClientId(), null, GrantType.CLIENT_CREDENTIALS, granted));

        return response(accessToken, null, granted);
    }

    /**
     * Rotates a refresh token. A token that was already rotated out is treated as stolen:
     * the whole family is revoked and the caller gets a plain {@code invalid_grant}.
     */
    @Transactional(noRollbackFor = OAuthException.class)
    public TokenResponse issueForRefreshToken(OAuthClient client, String refreshToken, String requestedScope) {
        if (refreshToken == null || refreshToken.isEmpty()) {
            throw OAuthException.invalidGrant("Invalid refresh token");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        OAuthToken stored = tokenRepository.findByTokenHash(tokenGenerator.hash(refreshToken))
                .filter(OAuthToken::isRefreshToken)
                .orElseThrow(() -> OAuthException.invalidGrant("Invalid refresh token"));

        if (!stored.getClientId().equals(client.getClientId())) {
            log.warn("Client {} presented a refresh token issued to {}", client.getClientId(), stored.getClientId());
            throw OAuthException.invalidGrant("Invalid refresh token");
        }

        if (stored.isRotated()) {
            throw reuseDetected(stored, now);
        }

        if (stored.isRevoked()) {
            throw OAuthException.invalidGrant("Refresh token has been revoked");
        }

        if (stored.isExpired(now)) {
            throw OAuthException.invalidGrant("Refresh token has expired");
        }

        List<String> scopes = stored.getScopes();
        Set<String> requested = Scopes.parse(requestedScope);
        if (!requested.isEmpty()) {
            if (!Scopes.isSubset(requested, stored.getScopes())) {
                throw OAuthException.invalidScope("Requested scope exceeds the scope originally granted");
            }
            scopes = new ArrayList<>(requested);
        }

        // The new pair is written before the rotation so a concurrent reuse detection revokes it with the family
        String accessToken = tokenGenerator.generateToken();
        save(TokenType.ACCESS_TOKEN, accessToken, client, stored.getUserId(), scopes, stored.getFamilyId(),
                stored.getAuthorizationCodeId(), null, now);

        String newRefreshToken = tokenGenerator.generateToken();
        OAuthToken rotated = save(TokenType.REFRESH_TOKEN, newRefreshToken, client, stored.getUserId(), scopes,
                stored.getFamilyId(), stored.getAuthorizationCodeId(), stored.getId(), now);

        if (!tokenRepository.markRotated(stored.getId(), now)) {
            // A concurrent refresh won the rotation
            throw reuseDetected(stored, now);
        }
        tokenRepository.linkRotation(stored.getId(), rotated.getId());

        log.info("Rotated refresh token {} to {} for client {}", stored.getId(), rotated.getId(), client.getClientId());
        AuditEvent event = AuditEvent.of(AuditEvent.EventType.TOKEN_REFRESHED, client.getClientId(), stored.getUserId(),
                "Refresh token rotated");
        event.getAdditionalData().put("family_id", stored.getFamilyId());
        auditSink.record(event);

        return response(accessToken, newRefreshToken, scopes);
    }

    private OAuthToken save(TokenType tokenType, String rawToken, OAuthClient client, String userId, List<String> scopes,
                            String familyId, String authorizationCodeId, String rotatedFromId, OffsetDateTime now) {
        Duration ttl = tokenType == TokenType.ACCESS_TOKEN
                ? properties.getAccessTokenTimeToLive()
                : properties.getRefreshTokenTimeToLive();

        OAuthToken token = OAuthToken.builder()
                .id(UUID.randomUUID().toString())
                .tokenHash(tokenGenerator.hash(rawToken))
                .tokenType(tokenType)
                .clientId(client.getClientId())
                .userId(userId)
                .scopes(new ArrayList<>(scopes))
                .familyId(familyId)
                .authorizationCodeId(authorizationCodeId)
                .rotatedFromId(rotatedFromId)
                .issuedAt(now)
                .expiresAt(now.plus(ttl))
                .build();

        tokenRepository.save(token);
        return token;
    }

    private TokenResponse response(String accessToken, String refreshToken, List<String> scopes) {
        return TokenResponse.builder()
                .accessToken(accessToken)
                .expiresIn(properties.getAccessTokenTimeToLive().toSeconds())
                .refreshToken(refreshToken)
                .scope(Scopes.format(scopes))
                .build();
    }

    private OAuthException reuseDetected(OAuthToken stored, OffsetDateTime now) {
        int revoked = tokenRepository.revokeFamily(stored.getFamilyId(), now);
        log.warn("Rotated refresh token {} presented again by client {}; revoked {} tokens in family {}",
                stored.getId(), stored.getClientId(), revoked, stored.getFamilyId());
        auditSink.record(AuditEvent.refreshTokenReuseDetected(stored.getClientId(), stored.getUserId(),
                stored.getFamilyId(), revoked));
        return OAuthException.invalidGrant("Invalid refresh token");
    }
}
