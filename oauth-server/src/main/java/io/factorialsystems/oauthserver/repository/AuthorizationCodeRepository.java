package io.factorialsystems.oauthserver.repository;

import io.factorialsystems.oauthserver.model.AuthorizationCode;

import java.time.OffsetDateTime;
import java.util.Optional;

public interface AuthorizationCodeRepository {

    void save(AuthorizationCode authorizationCode);

    Optional<AuthorizationCode> findByCodeHash(String codeHash);

    /**
     * Atomically moves an unexpired code from issued to consumed.
     *
     * @return true for exactly one caller per code; false if it was already consumed or has expired
     */
    boolean markConsumed(String codeId, OffsetDateTime now);

    /**
     * Marks expired, never exchanged codes as consumed so a later sweep can delete them.
     */
    int retireExpired(OffsetDateTime now);

    /**
     * Deletes codes that are consumed and expired before {@code cutoff}.
     */
    int deleteExpired(OffsetDateTime cutoff);
}
