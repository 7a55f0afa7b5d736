package io.factorialsystems.oauthserver.service;

import io.factorialsystems.oauthserver.dto.ClientCreateRequest;
import io.factorialsystems.oauthserver.dto.ClientResponse;
import io.factorialsystems.oauthserver.dto.ClientUpdateRequest;
import io.factorialsystems.oauthserver.exception.OAuthException;
import io.factorialsystems.oauthserver.model.AuditEvent;
import io.factorialsystems.oauthserver.model.GrantType;
import io.factorialsystems.oauthserver.model.OAuthClient;
import io.factorialsystems.oauthserver.model.TokenEndpointAuthMethod;
import io.factorialsystems.oauthserver.repository.ClientRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Administrative client management. Every change evicts the cached client so authentication
 * sees it on the next request.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClientAdministrationService {

    private final ClientRepository clientRepository;
    private final ClientMetadataValidator metadataValidator;
    private final ClientCacheService clientCacheService;
    private final SecureTokenGenerator tokenGenerator;
    private final PasswordEncoder passwordEncoder;
    private final AuditSink auditSink;
    private final Clock clock;

    @Transactional
    public ClientResponse createClient(ClientCreateRequest request, String adminUserId) {
        TokenEndpointAuthMethod authMethod = metadataValidator.validateAuthMethod(request.getTokenEndpointAuthMethod());
        List<GrantType> grantTypes = metadataValidator.validateGrantTypes(request.getGrantTypes(), authMethod);

        List<String> redirectUris = new ArrayList<>();
        if (grantTypes.contains(GrantType.AUTHORIZATION_CODE)) {
            redirectUris.addAll(metadataValidator.validateRedirectUris(request.getRedirectUris()));
        }

        boolean confidential = authMethod != TokenEndpointAuthMethod.NONE;
        String clientSecret = confidential ? tokenGenerator.generateToken() : null;
        OffsetDateTime now = OffsetDateTime.now(clock);

        OAuthClient client = OAuthClient.builder()
                .id(UUID.randomUUID().toString())
                .clientId(tokenGenerator.generateClientId())
                .clientSecretHash(clientSecret != null ? passwordEncoder.encode(clientSecret) : null)
                .clientName(request.getClientName())
                .isConfidential(confidential)
                .isEnabled(true)
                .isAutoApprove(Boolean.TRUE.equals(request.getIsAutoApprove()))
                .tokenEndpointAuthMethod(authMethod)
                .redirectUris(redirectUris)
                .grantTypes(grantTypes.stream().map(GrantType::getValue).collect(Collectors.toList()))
                .scopes(new ArrayList<>(new LinkedHashSet<>(request.getScopes())))
                .createdBy(adminUserId)
                .createdAt(now)
                .updatedAt(now)
                .build();

        clientRepository.save(client);

        log.info("Created OAuth client {} by admin {}", client.getClientId(), adminUserId);
        auditSink.record(AuditEvent.of(AuditEvent.EventType.CLIENT_REGISTERED, client.getClientId(), adminUserId,
                "Client created by administrator"));

        ClientResponse response = toResponse(client);
        response.setClientSecret(clientSecret);
        return response;
    }

    public List<ClientResponse> listClients() {
        return clientRepository.findAll().stream()
                .map(this::toResponse)
                .collect(Collectors.toList());
    }

    public ClientResponse getClient(String clientId) {
        return toResponse(findClient(clientId));
    }

    @Transactional
    public ClientResponse updateClient(String clientId, ClientUpdateRequest request, String adminUserId) {
        OAuthClient client = findClient(clientId);

        if (request.getClientName() != null) {
            client.setClientName(request.getClientName());
        }
        if (request.getRedirectUris() != null) {
            client.setRedirectUris(new ArrayList<>(metadataValidator.validateRedirectUris(request.getRedirectUris())));
        }
        if (request.getScopes() != null) {
            if (request.getScopes().isEmpty()) {
                throw OAuthException.invalidClientMetadata("At least one scope is required");
            }
            client.setScopes(new ArrayList<>(new LinkedHashSet<>(request.getScopes())));
        }
        if (request.getIsAutoApprove() != null) {
            client.setIsAutoApprove(request.getIsAutoApprove());
        }
        client.setUpdatedAt(OffsetDateTime.now(clock));

        clientRepository.updateMetadata(client);
        clientCacheService.evictClient(clientId);

        log.info("Updated OAuth client {} by admin {}", clientId, adminUserId);
        auditSink.record(AuditEvent.of(AuditEvent.EventType.CLIENT_UPDATED, clientId, adminUserId, "Client metadata updated"));
        return toResponse(client);
    }

    /**
     * Disabling blocks authentication immediately; issued tokens are left to expire.
     */
    @Transactional
    public ClientResponse setEnabled(String clientId, boolean enabled, String adminUserId) {
        if (!clientRepository.updateEnabled(clientId, enabled, OffsetDateTime.now(clock))) {
            throw OAuthException.invalidRequest("Unknown client: " + clientId);
        }
        clientCacheService.evictClient(clientId);

        log.info("{} OAuth client {} by admin {}", enabled ? "Enabled" : "Disabled", clientId, adminUserId);
        auditSink.record(AuditEvent.of(enabled ? AuditEvent.EventType.CLIENT_ENABLED : AuditEvent.EventType.CLIENT_DISABLED,
                clientId, adminUserId, enabled ? "Client enabled" : "Client disabled"));
        return toResponse(findClient(clientId));
    }

    @Transactional
    public ClientResponse rotateSecret(String clientId, String adminUserId) {
        OAuthClient client = findClient(clientId);
        if (client.isPublicClient()) {
            throw OAuthException.invalidRequest("Public clients have no secret");
        }

        String clientSecret = tokenGenerator.generateToken();
        clientRepository.updateSecretHash(clientId, passwordEncoder.encode(clientSecret), OffsetDateTime.now(clock));
        clientCacheService.evictClient(clientId);

        log.info("Rotated secret of OAuth client {} by admin {}", clientId, adminUserId);
        auditSink.record(AuditEvent.of(AuditEvent.EventType.CLIENT_SECRET_ROTATED, clientId, adminUserId,
                "Client secret rotated"));

        ClientResponse response = toResponse(client);
        response.setClientSecret(clientSecret);
        return response;
    }

    private OAuthClient findClient(String clientId) {
        return clientRepository.findByClientId(clientId)
                .orElseThrow(() -> OAuthException.invalidRequest("Unknown client: " + clientId));
    }

    private ClientResponse toResponse(OAuthClient client) {
        return ClientResponse.builder()
                .clientId(client.getClientId())
                .clientName(client.getClientName())
                .isConfidential(client.getIsConfidential())
                .isEnabled(client.getIsEnabled())
                .isAutoApprove(client.getIsAutoApprove())
                .tokenEndpointAuthMethod(client.getTokenEndpointAuthMethod() != null
                        ? client.getTokenEndpointAuthMethod().getValue() : null)
                .redirectUris(client.getRedirectUris())
                .grantTypes(client.getGrantTypes())
                .scopes(client.getScopes())
                .createdBy(client.getCreatedBy())
                .createdAt(client.getCreatedAt())
                .updatedAt(client.getUpdatedAt())
                .build();
    }
}
