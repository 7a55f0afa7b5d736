package io.factorialsystems.oauthserver.service;

import io.factorialsystems.oauthserver.config.OAuthServerProperties;
import io.factorialsystems.oauthserver.dto.IntrospectionResponse;
import io.factorialsystems.oauthserver.dto.TokenResponse;
import io.factorialsystems.oauthserver.exception.OAuthException;
import io.factorialsystems.oauthserver.model.OAuthClient;
import io.factorialsystems.oauthserver.model.OAuthToken;
import io.factorialsystems.oauthserver.model.TokenType;
import io.factorialsystems.oauthserver.model.User;
import io.factorialsystems.oauthserver.repository.TokenRepository;
import io.factorialsystems.oauthserver.repository.UserRepository;
import io.factorialsystems.oauthserver.security.ClientCredentials;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * Token introspection, open to confidential clients only. The owning client and clients holding
 * {@value #INTROSPECT_SCOPE} see full metadata; any other authenticated caller only learns whether
 * the token is active.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IntrospectionService {

    public static final String INTROSPECT_SCOPE = "token:introspect";

    private final ClientRegistry clientRegistry;
    private final TokenRepository tokenRepository;
    private final UserRepository userRepository;
    private final SecureTokenGenerator tokenGenerator;
    private final OAuthServerProperties properties;
    private final Clock clock;

    public IntrospectionResponse introspect(ClientCredentials credentials, String token, String tokenTypeHint) {
        OAuthClient caller = clientRegistry.authenticate(credentials);

        // Only confidential clients that proved their secret may introspect
        if (caller.isPublicClient() || !credentials.hasSecret()) {
            log.warn("Rejected introspection by client {} without a client secret", caller.getClientId());
            throw OAuthException.invalidClient();
        }

        if (token == null || token.isEmpty()) {
            throw OAuthException.invalidRequest("Missing token parameter");
        }

        // The hint is advisory; both token types share one store
        log.debug("Introspection by client {} with hint {}", caller.getClientId(), tokenTypeHint);

        OffsetDateTime now = OffsetDateTime.now(clock);
        Optional<OAuthToken> found = tokenRepository.findByTokenHash(tokenGenerator.hash(token));
        if (found.isEmpty() || !found.get().isActive(now)) {
            return IntrospectionResponse.inactive();
        }

        OAuthToken stored = found.get();
        boolean owner = stored.getClientId().equals(caller.getClientId());
        if (!owner && !caller.getScopes().contains(INTROSPECT_SCOPE)) {
            log.debug("Client {} introspected a token of another client; returning active flag only", caller.getClientId());
            return IntrospectionResponse.activeOnly();
        }

        return IntrospectionResponse.builder()
                .active(true)
                .scope(Scopes.format(stored.getScopes()))
                .clientId(stored.getClientId())
                .sub(stored.getUserId() != null ? stored.getUserId() : stored.getClientId())
                .username(stored.getUserId() != null
                        ? userRepository.findById(stored.getUserId()).map(User::getUsername).orElse(null)
                        : null)
                .tokenType(stored.getTokenType() == TokenType.ACCESS_TOKEN ? TokenResponse.BEARER : stored.getTokenType().getHint())
                .exp(stored.getExpiresAt().toEpochSecond())
                .iat(stored.getIssuedAt().toEpochSecond())
                .iss(properties.getIssuer())
                .build();
    }
}
