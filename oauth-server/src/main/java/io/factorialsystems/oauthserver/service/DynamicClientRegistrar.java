package io.factorialsystems.oauthserver.service;

import io.factorialsystems.oauthserver.config.OAuthServerProperties;
import io.factorialsystems.oauthserver.dto.ClientRegistrationRequest;
import io.factorialsystems.oauthserver.dto.ClientRegistrationResponse;
import io.factorialsystems.oauthserver.exception.OAuthException;
import io.factorialsystems.oauthserver.model.AuditEvent;
import io.factorialsystems.oauthserver.model.GrantType;
import io.factorialsystems.oauthserver.model.OAuthClient;
import io.factorialsystems.oauthserver.model.TokenEndpointAuthMethod;
import io.factorialsystems.oauthserver.repository.ClientRepository;
import io.factorialsystems.oauthserver.repository.TokenRepository;
import io.factorialsystems.oauthserver.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * RFC 7591 dynamic registration plus the RFC 7592 read and delete operations.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DynamicClientRegistrar {

    private final ClientRepository clientRepository;
    private final TokenRepository tokenRepository;
    private final UserRepository userRepository;
    private final ClientMetadataValidator metadataValidator;
    private final ClientCacheService clientCacheService;
    private final SecureTokenGenerator tokenGenerator;
    private final PasswordEncoder passwordEncoder;
    private final OAuthServerProperties properties;
    private final AuditSink auditSink;
    private final Clock clock;

    @Transactional
    public ClientRegistrationResponse register(ClientRegistrationRequest request, String registeredByUserId) {
        String permission = properties.getRegistration().getPermission();
        if (registeredByUserId == null || !userRepository.hasPermission(registeredByUserId, permission)) {
            log.warn("User {} attempted client registration without {}", registeredByUserId, permission);
            throw OAuthException.accessDenied("Client registration requires the " + permission + " permission");
        }

        TokenEndpointAuthMethod authMethod = metadataValidator.validateAuthMethod(request.getTokenEndpointAuthMethod());
        List<GrantType> grantTypes = metadataValidator.validateGrantTypes(request.getGrantTypes(), authMethod);
        List<String> redirectUris = metadataValidator.validateRedirectUris(request.getRedirectUris());
        List<String> scopes = metadataValidator.validateScopes(request.getScope(),
                properties.getRegistration().getAllowedScopes(),
                properties.getRegistration().getDefaultScopes());

        boolean confidential = authMethod != TokenEndpointAuthMethod.NONE;
        String clientId = tokenGenerator.generateClientId();
        String clientSecret = confidential ? tokenGenerator.generateToken() : null;
        String registrationAccessToken = tokenGenerator.generateToken();
        OffsetDateTime now = OffsetDateTime.now(clock);

        OAuthClient client = OAuthClient.builder()
                .id(UUID.randomUUID().toString())
                .clientId(clientId)
                .clientSecretHash(clientSecret != null ? passwordEncoder.encode(clientSecret) : null)
                .clientName(request.getClientName())
                .isConfidential(confidential)
                .isEnabled(true)
                .isAutoApprove(false)
                .tokenEndpointAuthMethod(authMethod)
                .redirectUris(new ArrayList<>(redirectUris))
                .grantTypes(new ArrayList<>(grantTypes.stream().map(GrantType::getValue).toList()))
                .scopes(new ArrayList<>(scopes))
                .registrationAccessTokenHash(tokenGenerator.hash(registrationAccessToken))
                .createdBy(registeredByUserId)
                .createdAt(now)
                .updatedAt(now)
                .build();

        clientRepository.save(client);

        log.info("Registered OAuth client {} ({}) for user {}", clientId, authMethod.getValue(), registeredByUserId);
        AuditEvent event = AuditEvent.of(AuditEvent.EventType.CLIENT_REGISTERED, clientId, registeredByUserId,
                "Client registered dynamically");
        event.getAdditionalData().put("token_endpoint_auth_method", authMethod.getValue());
        auditSink.record(event);

        ClientRegistrationResponse response = toResponse(client);
        response.setClientSecret(clientSecret);
        response.setRegistrationAccessToken(registrationAccessToken);
        return response;
    }

    public ClientRegistrationResponse read(String clientId, String registrationAccessToken) {
        OAuthClient client = authorizeManagement(clientId, registrationAccessToken);
        return toResponse(client);
    }

    /**
     * Disables the client and revokes every token issued to it. Clients are never deleted.
     */
    @Transactional
    public void deregister(String clientId, String registrationAccessToken) {
        OAuthClient client = authorizeManagement(clientId, registrationAccessToken);
        OffsetDateTime now = OffsetDateTime.now(clock);

        clientRepository.updateEnabled(client.getClientId(), false, now);
        int revoked = tokenRepository.revokeByClient(client.getClientId(), now);
        clientCacheService.evictClient(client.getClientId());

        log.info("Deregistered OAuth client {}; revoked {} tokens", client.getClientId(), revoked);
        AuditEvent event = AuditEvent.of(AuditEvent.EventType.CLIENT_DISABLED, client.getClientId(), null,
                "Client deregistered through its registration access token");
        event.getAdditionalData().put("revoked_tokens", revoked);
        auditSink.record(event);
    }

    private OAuthClient authorizeManagement(String clientId, String registrationAccessToken) {
        if (registrationAccessToken == null || registrationAccessToken.isEmpty()) {
            throw OAuthException.invalidToken("Missing registration access token");
        }

        OAuthClient client = clientRepository.findByClientId(clientId)
                .filter(OAuthClient::isEnabledClient)
                .orElseThrow(() -> OAuthException.invalidToken("Invalid registration access token"));

        String expected = client.getRegistrationAccessTokenHash();
        String presented = tokenGenerator.hash(registrationAccessToken);
        if (expected == null || !MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.US_ASCII), presented.getBytes(StandardCharsets.US_ASCII))) {
            log.warn("Bad registration access token presented for client {}", clientId);
            throw OAuthException.invalidToken("Invalid registration access token");
        }
        return client;
    }

    private ClientRegistrationResponse toResponse(OAuthClient client) {
        return ClientRegistrationResponse.builder()
                .clientId(client.getClientId())
                .clientIdIssuedAt(client.getCreatedAt() != null ? client.getCreatedAt().toEpochSecond() : null)
                .clientSecretExpiresAt(client.isConfidentialClient() ? 0L : null)
                .registrationClientUri(properties.getIssuer() + "/register/" + client.getClientId())
                .clientName(client.getClientName())
                .redirectUris(client.getRedirectUris())
                .grantTypes(client.getGrantTypes())
                .tokenEndpointAuthMethod(client.getTokenEndpointAuthMethod() != null
                        ? client.getTokenEndpointAuthMethod().getValue() : null)
                .scope(Scopes.format(client.getScopes()))
                .build();
    }
}
