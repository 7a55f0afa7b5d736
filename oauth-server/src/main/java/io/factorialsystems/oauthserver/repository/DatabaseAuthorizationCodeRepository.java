package io.factorialsystems.oauthserver.repository;

import io.factorialsystems.oauthserver.mapper.AuthorizationCodeMapper;
import io.factorialsystems.oauthserver.model.AuthorizationCode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class DatabaseAuthorizationCodeRepository implements AuthorizationCodeRepository {

    private final AuthorizationCodeMapper authorizationCodeMapper;

    @Override
    public void save(AuthorizationCode authorizationCode) {
        int result = authorizationCodeMapper.insert(authorizationCode);
        if (result <= 0) {
            throw new IllegalStateException("Failed to insert authorization code");
        }
    }

    @Override
    public Optional<AuthorizationCode> findByCodeHash(String codeHash) {
        return Optional.ofNullable(authorizationCodeMapper.findByCodeHash(codeHash));
    }

    @Override
    public boolean markConsumed(String codeId, OffsetDateTime now) {
        return authorizationCodeMapper.markConsumed(codeId, now) == 1;
    }

    @Override
    public int retireExpired(OffsetDateTime now) {
        return authorizationCodeMapper.retireExpired(now);
    }

    @Override
    public int deleteExpired(OffsetDateTime cutoff) {
        return authorizationCodeMapper.deleteExpired(cutoff);
    }
}
