package io.factorialsystems.oauthserver.service;

import io.factorialsystems.oauthserver.exception.OAuthException;
import io.factorialsystems.oauthserver.model.AuditEvent;
import io.factorialsystems.oauthserver.model.GrantType;
import io.factorialsystems.oauthserver.model.OAuthClient;
import io.factorialsystems.oauthserver.model.TokenEndpointAuthMethod;
import io.factorialsystems.oauthserver.repository.ClientRepository;
import io.factorialsystems.oauthserver.security.ClientCredentials;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Resolves and authenticates OAuth clients. Every authentication failure surfaces as the same
 * generic {@code invalid_client}; the concrete reason only reaches the log and the audit sink.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClientRegistry {

    private static final String DUMMY_SECRET = "dummy-client-secret";

    private final ClientRepository clientRepository;
    private final ClientCacheService clientCacheService;
    private final PasswordEncoder passwordEncoder;
    private final AuditSink auditSink;

    private volatile String dummySecretHash;

    public Optional<OAuthClient> resolve(String clientId) {
        if (clientId == null || clientId.isBlank()) {
            return Optional.empty();
        }

        OAuthClient cached = clientCacheService.getCachedClient(clientId);
        if (cached != null) {
            return Optional.of(cached);
        }

        Optional<OAuthClient> client = clientRepository.findByClientId(clientId);
        client.ifPresent(clientCacheService::cacheClient);
        return client;
    }

    public OAuthClient authenticate(ClientCredentials credentials) {
        OAuthClient client = resolve(credentials.clientId()).orElse(null);

        if (client == null) {
            // Keep the timing of unknown ids close to a wrong secret
            passwordEncoder.matches(credentials.hasSecret() ? credentials.clientSecret() : DUMMY_SECRET, dummySecretHash());
            throw failure(credentials.clientId(), "unknown client");
        }

        if (!client.isEnabledClient()) {
            throw failure(client.getClientId(), "client disabled");
        }

        if (client.isPublicClient()) {
            if (credentials.hasSecret()) {
                throw failure(client.getClientId(), "public client presented a secret");
            }
            return client;
        }

        if (!credentials.hasSecret()) {
            throw failure(client.getClientId(), "confidential client presented no secret");
        }

        if (registeredAuthMethod(client) != credentials.authMethod()) {
            throw failure(client.getClientId(),
                    "authentication method " + credentials.authMethod().getValue() + " not registered for client");
        }

        if (client.getClientSecretHash() == null
                || !passwordEncoder.matches(credentials.clientSecret(), client.getClientSecretHash())) {
            throw failure(client.getClientId(), "bad client secret");
        }

        log.debug("Authenticated client {} using {}", client.getClientId(), credentials.authMethod().getValue());
        return client;
    }

    public boolean supportsGrant(OAuthClient client, GrantType grantType) {
        return client.supportsGrant(grantType);
    }

    public boolean supportsRedirect(OAuthClient client, String redirectUri) {
        return client.hasRedirectUri(redirectUri);
    }

    private TokenEndpointAuthMethod registeredAuthMethod(OAuthClient client) {
        if (client.getTokenEndpointAuthMethod() != null) {
            return client.getTokenEndpointAuthMethod();
        }
        return client.isConfidentialClient() ? TokenEndpointAuthMethod.CLIENT_SECRET_BASIC : TokenEndpointAuthMethod.NONE;
    }

    private OAuthException failure(String clientId, String reason) {
        log.warn("Client authentication failed for {}: {}", clientId, reason);
        auditSink.record(AuditEvent.clientAuthenticationFailed(clientId, reason));
        return OAuthException.invalidClient();
    }

    private String dummySecretHash() {
        String hash = dummySecretHash;
        if (hash == null) {
            hash = passwordEncoder.encode(DUMMY_SECRET);
            dummySecretHash = hash;
        }
        return hash;
    }
}
