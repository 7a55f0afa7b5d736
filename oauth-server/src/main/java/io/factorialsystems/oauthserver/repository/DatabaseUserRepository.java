package io.factorialsystems.oauthserver.repository;

import io.factorialsystems.oauthserver.mapper.UserMapper;
import io.factorialsystems.oauthserver.model.User;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class DatabaseUserRepository implements UserRepository {

    private final UserMapper userMapper;

    @Override
    public Optional<User> findByUsername(String username) {
        return Optional.ofNullable(userMapper.findByUsername(username));
    }

    @Override
    public Optional<User> findById(String userId) {
        return Optional.ofNullable(userMapper.findById(userId));
    }

    @Override
    public boolean hasPermission(String userId, String permission) {
        return userMapper.findPermissionsByUserId(userId).contains(permission);
    }
}
