package io.factorialsystems.oauthserver.service;

import io.factorialsystems.oauthserver.exception.OAuthException;
import io.factorialsystems.oauthserver.model.AuditEvent;
import io.factorialsystems.oauthserver.model.OAuthClient;
import io.factorialsystems.oauthserver.model.OAuthToken;
import io.factorialsystems.oauthserver.repository.TokenRepository;
import io.factorialsystems.oauthserver.security.ClientCredentials;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * RFC 7009 revocation. Unknown tokens and tokens of other clients are silently ignored so the
 * endpoint cannot be used to probe for valid tokens.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RevocationService {

    private final ClientRegistry clientRegistry;
    private final TokenRepository tokenRepository;
    private final SecureTokenGenerator tokenGenerator;
    private final AuditSink auditSink;
    private final Clock clock;

    @Transactional
    public void revoke(ClientCredentials credentials, String token, String tokenTypeHint) {
        OAuthClient caller = clientRegistry.authenticate(credentials);

        if (token == null || token.isEmpty()) {
            throw OAuthException.invalidRequest("Missing token parameter");
        }

        Optional<OAuthToken> found = tokenRepository.findByTokenHash(tokenGenerator.hash(token));
        if (found.isEmpty()) {
            log.debug("Revocation of unknown token requested by client {} (hint {})", caller.getClientId(), tokenTypeHint);
            return;
        }

        OAuthToken stored = found.get();
        if (!stored.getClientId().equals(caller.getClientId())) {
            log.warn("Client {} attempted to revoke a token owned by {}", caller.getClientId(), stored.getClientId());
            return;
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        int revoked;
        if (stored.isRefreshToken()) {
            revoked = tokenRepository.revokeFamily(stored.getFamilyId(), now);
        } else {
            revoked = tokenRepository.revoke(stored.getId(), now) ? 1 : 0;
        }

        log.info("Client {} revoked {} {} (family {})", caller.getClientId(), revoked,
                revoked == 1 ? "token" : "tokens", stored.getFamilyId());
        auditSink.record(AuditEvent.tokenRevoked(caller.getClientId(), stored.getUserId(), stored.getTokenType(), revoked));
    }
}
