package io.factorialsystems.oauthserver.repository;

import io.factorialsystems.oauthserver.model.OAuthClient;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Client store. Clients are disabled, never deleted.
 */
public interface ClientRepository {

    Optional<OAuthClient> findByClientId(String clientId);

    List<OAuthClient> findAll();

    void save(OAuthClient client);

    void updateMetadata(OAuthClient client);

    boolean updateEnabled(String clientId, boolean enabled, OffsetDateTime now);

    boolean updateSecretHash(String clientId, String secretHash, OffsetDateTime now);
}
