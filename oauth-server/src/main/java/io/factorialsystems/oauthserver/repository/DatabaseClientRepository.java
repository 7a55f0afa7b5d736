package io.factorialsystems.oauthserver.repository;

import io.factorialsystems.oauthserver.mapper.OAuthClientMapper;
import io.factorialsystems.oauthserver.model.OAuthClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Slf4j
@Repository
@RequiredArgsConstructor
public class DatabaseClientRepository implements ClientRepository {

    private final OAuthClientMapper clientMapper;

    @Override
    public Optional<OAuthClient> findByClientId(String clientId) {
        log.debug("Finding OAuth client by clientId: {}", clientId);
        return Optional.ofNullable(clientMapper.findByClientId(clientId));
    }

    @Override
    public List<OAuthClient> findAll() {
        return clientMapper.findAll();
    }

    @Override
    public void save(OAuthClient client) {
        int result = clientMapper.insert(client);
        if (result <= 0) {
            throw new IllegalStateException("Failed to insert OAuth client " + client.getClientId());
        }
        log.debug("Inserted OAuth client: {}", client.getClientId());
    }

    @Override
    public void updateMetadata(OAuthClient client) {
        clientMapper.updateMetadata(client);
        log.debug("Updated OAuth client metadata: {}", client.getClientId());
    }

    @Override
    public boolean updateEnabled(String clientId, boolean enabled, OffsetDateTime now) {
        return clientMapper.updateEnabled(clientId, enabled, now) > 0;
    }

    @Override
    public boolean updateSecretHash(String clientId, String secretHash, OffsetDateTime now) {
        return clientMapper.updateSecretHash(clientId, secretHash, now) > 0;
    }
}
