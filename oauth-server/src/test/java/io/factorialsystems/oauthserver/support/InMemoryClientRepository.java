package io.factorialsystems.oauthserver.support;

import io.factorialsystems.oauthserver.model.OAuthClient;
import io.factorialsystems.oauthserver.repository.ClientRepository;

import java.time.OffsetDateTime;
import java.util.*;

public class InMemoryClientRepository implements ClientRepository {

    private final Map<String, OAuthClient> clients = new LinkedHashMap<>();

    @Override
    public synchronized Optional<OAuthClient> findByClientId(String clientId) {
        return Optional.ofNullable(clients.get(clientId)).map(InMemoryClientRepository::copy);
    }

    @Override
    public synchronized List<OAuthClient> findAll() {
        return clients.values().stream().map(InMemoryClientRepository::copy).toList();
    }

    @Override
    public synchronized void save(OAuthClient client) {
        if (clients.containsKey(client.getClientId())) {
            throw new IllegalStateException("Duplicate client " + client.getClientId());
        }
        clients.put(client.getClientId(), copy(client));
    }

    @Override
    public synchronized void updateMetadata(OAuthClient client) {
        OAuthClient existing = clients.get(client.getClientId());
        if (existing == null) {
            return;
        }
        existing.setClientName(client.getClientName());
        existing.setIsAutoApprove(client.getIsAutoApprove());
        existing.setRedirectUris(new ArrayList<>(client.getRedirectUris()));
        existing.setGrantTypes(new ArrayList<>(client.getGrantTypes()));
        existing.setScopes(new ArrayList<>(client.getScopes()));
        existing.setUpdatedAt(client.getUpdatedAt());
    }

    @Override
    public synchronized boolean updateEnabled(String clientId, boolean enabled, OffsetDateTime now) {
        OAuthClient existing = clients.get(clientId);
        if (existing == null) {
            return false;
        }
        existing.setIsEnabled(enabled);
        existing.setUpdatedAt(now);
        return true;
    }

    @Override
    public synchronized boolean updateSecretHash(String clientId, String secretHash, OffsetDateTime now) {
        OAuthClient existing = clients.get(clientId);
        if (existing == null) {
            return false;
        }
        existing.setClientSecretHash(secretHash);
        existing.setUpdatedAt(now);
        return true;
    }

    private static OAuthClient copy(OAuthClient client) {
        return client.toBuilder()
                .redirectUris(new ArrayList<>(client.getRedirectUris()))
                .grantTypes(new ArrayList<>(client.getGrantTypes()))
                .scopes(new ArrayList<>(client.getScopes()))
                .build();
    }
}
