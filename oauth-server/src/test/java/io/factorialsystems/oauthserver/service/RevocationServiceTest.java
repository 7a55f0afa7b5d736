package io.factorialsystems.oauthserver.service;

import io.factorialsystems.oauthserver.dto.TokenResponse;
import io.factorialsystems.oauthserver.exception.OAuthError;
import io.factorialsystems.oauthserver.exception.OAuthException;
import io.factorialsystems.oauthserver.model.AuditEvent;
import io.factorialsystems.oauthserver.model.GrantType;
import io.factorialsystems.oauthserver.model.OAuthClient;
import io.factorialsystems.oauthserver.model.OAuthToken;
import io.factorialsystems.oauthserver.support.OAuthTestFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.factorialsystems.oauthserver.support.OAuthTestFixture.REDIRECT_URI;
import static io.factorialsystems.oauthserver.support.OAuthTestFixture.basic;
import static org.junit.jupiter.api.Assertions.*;

class RevocationServiceTest {

    private OAuthTestFixture fixture;
    private RevocationService revocationService;
    private OAuthClient c1;
    private TokenResponse tokens;

    @BeforeEach
    void setUp() {
        fixture = new OAuthTestFixture();
        revocationService = fixture.revocationService;
        c1 = fixture.confidentialClient("c1", "s3cret", List.of("read"),
                GrantType.AUTHORIZATION_CODE, GrantType.REFRESH_TOKEN);
        fixture.confidentialClient("c2", "other", List.of("read"), GrantType.CLIENT_CREDENTIALS);
        tokens = fixture.tokenIssuer.issueForAuthCode(c1, fixture.issueCode("c1", "u1", "read").code(), REDIRECT_URI, null);
    }

    private OAuthToken stored(String rawToken) {
        return fixture.tokens.findByTokenHash(fixture.tokenGenerator.hash(rawToken)).orElseThrow();
    }

    @Test
    void revoke_refreshTokenRevokesTheWholeLineage() {
        TokenResponse rotated = fixture.tokenIssuer.issueForRefreshToken(c1, tokens.getRefreshToken(), null);

        revocationService.revoke(basic("c1", "s3cret"), rotated.getRefreshToken(), "refresh_token");

        assertTrue(fixture.tokens.findAll().stream().allMatch(OAuthToken::isRevoked));
        assertEquals(1, fixture.auditSink.count(AuditEvent.EventType.TOKEN_REVOKED));
    }

    @Test
    void revoke_accessTokenLeavesRefreshTokenUsable() {
        revocationService.revoke(basic("c1", "s3cret"), tokens.getAccessToken(), "access_token");

        assertTrue(stored(tokens.getAccessToken()).isRevoked());
        assertFalse(stored(tokens.getRefreshToken()).isRevoked());
    }

    @Test
    void revoke_hintDoesNotChangeTheOutcome() {
        revocationService.revoke(basic("c1", "s3cret"), tokens.getRefreshToken(), "access_token");

        assertTrue(stored(tokens.getAccessToken()).isRevoked());
        assertTrue(stored(tokens.getRefreshToken()).isRevoked());
    }

    @Test
    void revoke_unknownTokenIsANoOp() {
        assertDoesNotThrow(() -> revocationService.revoke(basic("c1", "s3cret"), "no-such-token", null));
        assertEquals(0, fixture.auditSink.count(AuditEvent.EventType.TOKEN_REVOKED));
    }

    @Test
    void revoke_tokenOfAnotherClientIsIgnored() {
        assertDoesNotThrow(() -> revocationService.revoke(basic("c2", "other"), tokens.getAccessToken(), null));

        assertFalse(stored(tokens.getAccessToken()).isRevoked());
    }

    @Test
    void revoke_revokedRefreshTokenCannotBeUsed() {
        revocationService.revoke(basic("c1", "s3cret"), tokens.getRefreshToken(), null);

        OAuthException exception = assertThrows(OAuthException.class,
                () -> fixture.tokenIssuer.issueForRefreshToken(c1, tokens.getRefreshToken(), null));
        assertEquals(OAuthError.INVALID_GRANT, exception.getError());
    }

    @Test
    void revoke_failedClientAuthenticationIsTheOnlyError() {
        OAuthException exception = assertThrows(OAuthException.class,
                () -> revocationService.revoke(basic("c1", "wrong"), tokens.getAccessToken(), null));

        assertEquals(OAuthError.INVALID_CLIENT, exception.getError());
        assertFalse(stored(tokens.getAccessToken()).isRevoked());
    }
}
