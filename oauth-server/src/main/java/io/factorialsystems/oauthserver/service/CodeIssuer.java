package io.factorialsystems.oauthserver.service;

import io.factorialsystems.oauthserver.config.OAuthServerProperties;
import io.factorialsystems.oauthserver.dto.ConsumedAuthorizationCode;
import io.factorialsystems.oauthserver.dto.IssuedAuthorizationCode;
import io.factorialsystems.oauthserver.exception.OAuthException;
import io.factorialsystems.oauthserver.model.AuditEvent;
import io.factorialsystems.oauthserver.model.AuthorizationCode;
import io.factorialsystems.oauthserver.model.OAuthClient;
import io.factorialsystems.oauthserver.repository.AuthorizationCodeRepository;
import io.factorialsystems.oauthserver.repository.TokenRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Issues authorization codes and consumes them exactly once.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CodeIssuer {

    private final AuthorizationCodeRepository authorizationCodeRepository;
    private final TokenRepository tokenRepository;
    private final SecureTokenGenerator tokenGenerator;
    private final OAuthServerProperties properties;
    private final AuditSink auditSink;
    private final Clock clock;

    public IssuedAuthorizationCode issue(OAuthClient client, String userId, String redirectUri, Collection<String> scopes,
                                         String codeChallenge, String codeChallengeMethod) {
        if (!client.hasRedirectUri(redirectUri)) {
            throw OAuthException.invalidRedirectUri("redirect_uri is not registered for this client");
        }

        if (codeChallenge != null) {
            if (!PkceVerifier.isSupportedMethod(codeChallengeMethod)) {
                throw OAuthException.invalidRequest("code_challenge_method must be S256");
            }
            if (!PkceVerifier.isWellFormedChallenge(codeChallenge)) {
                throw OAuthException.invalidRequest("Malformed code_challenge");
            }
        } else if (client.isPublicClient()) {
            throw OAuthException.invalidRequest("Public clients must use PKCE");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        String code = tokenGenerator.generateToken();

        AuthorizationCode authorizationCode = AuthorizationCode.builder()
                .id(UUID.randomUUID().toString())
                .codeHash(tokenGenerator.hash(code))
                .clientId(client.getClientId())
                .userId(userId)
                .redirectUri(redirectUri)
                .scopes(new ArrayList<>(scopes))
                .codeChallenge(codeChallenge)
                .codeChallengeMethod(codeChallenge != null ? PkceVerifier.S256 : null)
                .issuedAt(now)
                .expiresAt(now.plus(properties.getAuthorizationCodeTimeToLive()))
                .build();

        authorizationCodeRepository.save(authorizationCode);

        log.info("Issued authorization code {} for client {} and user {}", authorizationCode.getId(), client.getClientId(), userId);
        auditSink.record(AuditEvent.of(AuditEvent.EventType.AUTHORIZATION_CODE_ISSUED, client.getClientId(), userId,
                "Authorization code issued"));

        return new IssuedAuthorizationCode(code, authorizationCode.getId(), redirectUri,
                List.copyOf(authorizationCode.getScopes()), authorizationCode.getExpiresAt());
    }

    /**
     * Validates and burns a code. Every failure is reported as {@code invalid_grant}; a second
     * presentation of a consumed code additionally revokes the tokens minted from it.
     */
    public ConsumedAuthorizationCode consume(String code, OAuthClient client, String redirectUri, String codeVerifier) {
        if (code == null || code.isEmpty()) {
            throw OAuthException.invalidGrant("Invalid authorization code");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        AuthorizationCode stored = authorizationCodeRepository.findByCodeHash(tokenGenerator.hash(code))
                .orElseThrow(() -> OAuthException.invalidGrant("Invalid authorization code"));

        if (stored.isConsumed()) {
            throw replayDetected(stored, now);
        }

        if (stored.isExpired(now)) {
            throw OAuthException.invalidGrant("Authorization code has expired");
        }

        if (!stored.getClientId().equals(client.getClientId())) {
            log.warn("Client {} presented an authorization code issued to {}", client.getClientId(), stored.getClientId());
            throw OAuthException.invalidGrant("Invalid authorization code");
        }

        if (!stored.getRedirectUri().equals(redirectUri)) {
            throw OAuthException.invalidGrant("redirect_uri does not match the authorization request");
        }

        verifyPkce(stored, client, codeVerifier);

        if (!authorizationCodeRepository.markConsumed(stored.getId(), now)) {
            // Lost the race against a concurrent exchange of the same code
            throw replayDetected(stored, now);
        }

        log.debug("Consumed authorization code {} for client {}", stored.getId(), client.getClientId());
        return new ConsumedAuthorizationCode(stored.getId(), stored.getClientId(), stored.getUserId(),
                List.copyOf(stored.getScopes()));
    }

    private void verifyPkce(AuthorizationCode stored, OAuthClient client, String codeVerifier) {
        boolean verifierPresent = codeVerifier != null && !codeVerifier.isEmpty();

        if (stored.hasCodeChallenge()) {
            if (!verifierPresent) {
                throw OAuthException.invalidGrant("code_verifier is required");
            }
            if (!PkceVerifier.matches(codeVerifier, stored.getCodeChallenge(), stored.getCodeChallengeMethod())) {
                throw OAuthException.invalidGrant("PKCE verification failed");
            }
            return;
        }

        if (verifierPresent) {
            throw OAuthException.invalidGrant("code_verifier supplied for a code issued without code_challenge");
        }
        if (client.isPublicClient()) {
            throw OAuthException.invalidGrant("PKCE is required for public clients");
        }
    }

    private OAuthException replayDetected(AuthorizationCode stored, OffsetDateTime now) {
        int revoked = tokenRepository.revokeByAuthorizationCode(stored.getId(), now);
        log.warn("Authorization code {} for client {} presented again; revoked {} tokens",
                stored.getId(), stored.getClientId(), revoked);
        auditSink.record(AuditEvent.codeReplayDetected(stored.getClientId(), stored.getUserId(), stored.getId(), revoked));
        return OAuthException.invalidGrant("Invalid authorization code");
    }
}
