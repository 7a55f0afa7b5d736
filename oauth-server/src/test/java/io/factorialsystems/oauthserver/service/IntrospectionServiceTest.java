package io.factorialsystems.oauthserver.service;

import io.factorialsystems.oauthserver.dto.IntrospectionResponse;
import io.factorialsystems.oauthserver.dto.TokenResponse;
import io.factorialsystems.oauthserver.exception.OAuthError;
import io.factorialsystems.oauthserver.exception.OAuthException;
import io.factorialsystems.oauthserver.model.GrantType;
import io.factorialsystems.oauthserver.model.OAuthClient;
import io.factorialsystems.oauthserver.security.ClientCredentials;
import io.factorialsystems.oauthserver.support.OAuthTestFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static io.factorialsystems.oauthserver.support.OAuthTestFixture.REDIRECT_URI;
import static io.factorialsystems.oauthserver.support.OAuthTestFixture.basic;
import static org.junit.jupiter.api.Assertions.*;

class IntrospectionServiceTest {

    private OAuthTestFixture fixture;
    private IntrospectionService introspectionService;
    private TokenResponse tokens;

    @BeforeEach
    void setUp() {
        fixture = new OAuthTestFixture();
        introspectionService = fixture.introspectionService;
        fixture.user("u1", "alice");

        OAuthClient c1 = fixture.confidentialClient("c1", "s3cret", List.of("read", "write"),
                GrantType.AUTHORIZATION_CODE, GrantType.REFRESH_TOKEN);
        fixture.confidentialClient("c2", "other", List.of("read"), GrantType.CLIENT_CREDENTIALS);
        fixture.confidentialClient("rs", "resource", List.of(IntrospectionService.INTROSPECT_SCOPE),
                GrantType.CLIENT_CREDENTIALS);

        tokens = fixture.tokenIssuer.issueForAuthCode(c1, fixture.issueCode("c1", "u1", "read").code(), REDIRECT_URI, null);
    }

    @Test
    void introspect_ownerSeesFullMetadata() {
        IntrospectionResponse response = introspectionService.introspect(basic("c1", "s3cret"), tokens.getAccessToken(), null);

        assertTrue(response.isActive());
        assertEquals("read", response.getScope());
        assertEquals("c1", response.getClientId());
        assertEquals("u1", response.getSub());
        assertEquals("alice", response.getUsername());
        assertEquals("Bearer", response.getTokenType());
        assertEquals(fixture.now().plusHours(1).toEpochSecond(), response.getExp());
        assertEquals(fixture.now().toEpochSecond(), response.getIat());
        assertEquals(fixture.properties.getIssuer(), response.getIss());
    }

    @Test
    void introspect_otherClientLearnsOnlyTheActiveFlag() {
        IntrospectionResponse response = introspectionService.introspect(basic("c2", "other"), tokens.getAccessToken(), null);

        assertTrue(response.isActive());
        assertNull(response.getScope());
        assertNull(response.getClientId());
        assertNull(response.getSub());
        assertNull(response.getUsername());
        assertNull(response.getExp());
    }

    @Test
    void introspect_clientWithIntrospectScopeSeesFullMetadata() {
        IntrospectionResponse response = introspectionService.introspect(basic("rs", "resource"), tokens.getAccessToken(), null);

        assertEquals("c1", response.getClientId());
        assertEquals("read", response.getScope());
    }

    @Test
    void introspect_refreshTokenIsReportedWithItsType() {
        IntrospectionResponse response = introspectionService.introspect(basic("c1", "s3cret"),
                tokens.getRefreshToken(), "refresh_token");

        assertTrue(response.isActive());
        assertEquals("refresh_token", response.getTokenType());
    }

    @Test
    void introspect_unknownTokenIsInactive() {
        IntrospectionResponse response = introspectionService.introspect(basic("c1", "s3cret"), "no-such-token", null);

        assertFalse(response.isActive());
        assertNull(response.getClientId());
    }

    @Test
    void introspect_expiredTokenIsInactive() {
        fixture.clock.advance(Duration.ofHours(1));

        assertFalse(introspectionService.introspect(basic("c1", "s3cret"), tokens.getAccessToken(), null).isActive());
    }

    @Test
    void introspect_revokedTokenIsInactive() {
        fixture.revocationService.revoke(basic("c1", "s3cret"), tokens.getAccessToken(), null);

        assertFalse(introspectionService.introspect(basic("c1", "s3cret"), tokens.getAccessToken(), null).isActive());
    }

    @Test
    void introspect_requiresClientAuthentication() {
        OAuthException exception = assertThrows(OAuthException.class,
                () -> introspectionService.introspect(basic("c1", "wrong"), tokens.getAccessToken(), null));

        assertEquals(OAuthError.INVALID_CLIENT, exception.getError());
    }

    @Test
    void introspect_publicClientWithEmptySecretIsRejected() {
        fixture.publicClient("spa", List.of("read"), GrantType.AUTHORIZATION_CODE);

        OAuthException exception = assertThrows(OAuthException.class,
                () -> introspectionService.introspect(basic("spa", ""), tokens.getAccessToken(), null));

        assertEquals(OAuthError.INVALID_CLIENT, exception.getError());
    }

    @Test
    void introspect_publicClientCannotIntrospectItsOwnToken() {
        OAuthClient spa = fixture.publicClient("spa", List.of("read"), GrantType.AUTHORIZATION_CODE);
        TokenResponse spaTokens = fixture.tokenIssuer.issueForAuthCode(spa,
                fixture.issueCode("spa", "u1", "read").code(), REDIRECT_URI, OAuthTestFixture.CODE_VERIFIER);

        OAuthException exception = assertThrows(OAuthException.class,
                () -> introspectionService.introspect(ClientCredentials.none("spa"), spaTokens.getAccessToken(), null));

        assertEquals(OAuthError.INVALID_CLIENT, exception.getError());
    }

    @Test
    void introspect_missingTokenIsInvalidRequest() {
        OAuthException exception = assertThrows(OAuthException.class,
                () -> introspectionService.introspect(basic("c1", "s3cret"), null, null));

        assertEquals(OAuthError.INVALID_REQUEST, exception.getError());
    }
}
