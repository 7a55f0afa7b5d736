package io.factorialsystems.oauthserver.repository;

import io.factorialsystems.oauthserver.mapper.OAuthTokenMapper;
import io.factorialsystems.oauthserver.model.OAuthToken;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class DatabaseTokenRepository implements TokenRepository {

    private final OAuthTokenMapper tokenMapper;

    @Override
    public void save(OAuthToken token) {
        int result = tokenMapper.insert(token);
        if (result <= 0) {
            throw new IllegalStateException("Failed to insert " + token.getTokenType());
        }
    }

    @Override
    public Optional<OAuthToken> findByTokenHash(String tokenHash) {
        return Optional.ofNullable(tokenMapper.findByTokenHash(tokenHash));
    }

    @Override
    public boolean markRotated(String tokenId, OffsetDateTime now) {
        return tokenMapper.markRotated(tokenId, now) == 1;
    }

    @Override
    public void linkRotation(String tokenId, String rotatedToId) {
        tokenMapper.linkRotation(tokenId, rotatedToId);
    }

    @Override
    public boolean revoke(String tokenId, OffsetDateTime now) {
        return tokenMapper.revoke(tokenId, now) > 0;
    }

    @Override
    public int revokeFamily(String familyId, OffsetDateTime now) {
        return tokenMapper.revokeFamily(familyId, now);
    }

    @Override
    public int revokeByAuthorizationCode(String authorizationCodeId, OffsetDateTime now) {
        return tokenMapper.revokeByAuthorizationCode(authorizationCodeId, now);
    }

    @Override
    public int revokeByClient(String clientId, OffsetDateTime now) {
        return tokenMapper.revokeByClient(clientId, now);
    }

    @Override
    public int retireExpired(OffsetDateTime now) {
        return tokenMapper.retireExpired(now);
    }

    @Override
    public int deleteExpired(OffsetDateTime cutoff) {
        return tokenMapper.deleteExpired(cutoff);
    }
}
