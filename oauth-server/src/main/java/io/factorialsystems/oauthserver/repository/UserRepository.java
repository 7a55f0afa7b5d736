package io.factorialsystems.oauthserver.repository;

import io.factorialsystems.oauthserver.model.User;

import java.util.Optional;

/**
 * Read-only view of the platform's user and permission store.
 */
public interface UserRepository {

    Optional<User> findByUsername(String username);

    Optional<User> findById(String userId);

    boolean hasPermission(String userId, String permission);
}
