package io.factorialsystems.oauthserver.service;

import io.factorialsystems.oauthserver.dto.IssuedAuthorizationCode;
import io.factorialsystems.oauthserver.dto.TokenResponse;
import io.factorialsystems.oauthserver.exception.OAuthError;
import io.factorialsystems.oauthserver.exception.OAuthException;
import io.factorialsystems.oauthserver.model.AuditEvent;
import io.factorialsystems.oauthserver.model.GrantType;
import io.factorialsystems.oauthserver.model.OAuthClient;
import io.factorialsystems.oauthserver.model.OAuthToken;
import io.factorialsystems.oauthserver.model.TokenType;
import io.factorialsystems.oauthserver.support.OAuthTestFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static io.factorialsystems.oauthserver.support.OAuthTestFixture.REDIRECT_URI;
import static org.junit.jupiter.api.Assertions.*;

class TokenIssuerTest {

    private OAuthTestFixture fixture;
    private TokenIssuer tokenIssuer;
    private OAuthClient c1;

    @BeforeEach
    void setUp() {
        fixture = new OAuthTestFixture();
        tokenIssuer = fixture.tokenIssuer;
        c1 = fixture.confidentialClient("c1", "s3cret", List.of("read", "write"),
                GrantType.AUTHORIZATION_CODE, GrantType.REFRESH_TOKEN, GrantType.CLIENT_CREDENTIALS);
    }

    private TokenResponse exchangeCode(String scope) {
        IssuedAuthorizationCode issued = fixture.issueCode("c1", "u1", scope);
        return tokenIssuer.issueForAuthCode(c1, issued.code(), REDIRECT_URI, null);
    }

    private OAuthToken stored(String rawToken) {
        return fixture.tokens.findByTokenHash(fixture.tokenGenerator.hash(rawToken)).orElseThrow();
    }

    @Test
    void issueForAuthCode_returnsBearerPairWithGrantedScope() {
        TokenResponse response = exchangeCode("read");

        assertNotNull(response.getAccessToken());
        assertNotNull(response.getRefreshToken());
        assertEquals("Bearer", response.getTokenType());
        assertEquals(3600L, response.getExpiresIn());
        assertEquals("read", response.getScope());

        OAuthToken access = stored(response.getAccessToken());
        OAuthToken refresh = stored(response.getRefreshToken());
        assertEquals(TokenType.ACCESS_TOKEN, access.getTokenType());
        assertEquals(TokenType.REFRESH_TOKEN, refresh.getTokenType());
        assertEquals(access.getFamilyId(), refresh.getFamilyId());
        assertEquals("u1", access.getUserId());
        assertEquals(fixture.now().plusDays(30), refresh.getExpiresAt());
        assertEquals(1, fixture.auditSink.count(AuditEvent.EventType.TOKEN_ISSUED));
    }

    @Test
    void issueForAuthCode_noRefreshTokenWithoutRefreshGrant() {
        OAuthClient noRefresh = fixture.confidentialClient("c2", "s3cret", List.of("read"), GrantType.AUTHORIZATION_CODE);
        IssuedAuthorizationCode issued = fixture.issueCode("c2", "u1", "read");

        TokenResponse response = tokenIssuer.issueForAuthCode(noRefresh, issued.code(), REDIRECT_URI, null);

        assertNull(response.getRefreshToken());
    }

    @Test
    void issueForClientCredentials_intersectsRequestedWithAllowedScopes() {
        TokenResponse response = tokenIssuer.issueForClientCredentials(c1, "read admin");

        assertEquals("read", response.getScope());
        assertNull(response.getRefreshToken());
        assertNull(stored(response.getAccessToken()).getUserId());
    }

    @Test
    void issueForClientCredentials_noScopeRequestedGrantsAllClientScopes() {
        TokenResponse response = tokenIssuer.issueForClientCredentials(c1, null);

        assertEquals("read write", response.getScope());
    }

    @Test
    void issueForClientCredentials_disjointScopeIsRejected() {
        OAuthException exception = assertThrows(OAuthException.class,
                () -> tokenIssuer.issueForClientCredentials(c1, "admin"));

        assertEquals(OAuthError.INVALID_SCOPE, exception.getError());
        assertTrue(fixture.tokens.findAll().isEmpty());
    }

    @Test
    void issueForRefreshToken_rotatesWithinTheFamily() {
        TokenResponse first = exchangeCode("read write");

        TokenResponse second = tokenIssuer.issueForRefreshToken(c1, first.getRefreshToken(), null);

        assertNotEquals(first.getRefreshToken(), second.getRefreshToken());
        OAuthToken old = stored(first.getRefreshToken());
        OAuthToken rotated = stored(second.getRefreshToken());
        assertTrue(old.isRotated());
        assertTrue(old.isRevoked());
        assertEquals(rotated.getId(), old.getRotatedToId());
        assertEquals(old.getId(), rotated.getRotatedFromId());
        assertEquals(old.getFamilyId(), rotated.getFamilyId());
        assertEquals("read write", second.getScope());
    }

    @Test
    void issueForRefreshToken_canNarrowButNotWidenScope() {
        TokenResponse first = exchangeCode("read");

        OAuthException widened = assertThrows(OAuthException.class,
                () -> tokenIssuer.issueForRefreshToken(c1, first.getRefreshToken(), "read write"));
        TokenResponse narrowed = tokenIssuer.issueForRefreshToken(c1, first.getRefreshToken(), "read");

        assertEquals(OAuthError.INVALID_SCOPE, widened.getError());
        assertEquals("read", narrowed.getScope());
    }

    @Test
    void issueForRefreshToken_reuseRevokesTheWholeFamily() {
        TokenResponse first = exchangeCode("read");
        TokenResponse second = tokenIssuer.issueForRefreshToken(c1, first.getRefreshToken(), null);

        OAuthException exception = assertThrows(OAuthException.class,
                () -> tokenIssuer.issueForRefreshToken(c1, first.getRefreshToken(), null));

        assertEquals(OAuthError.INVALID_GRANT, exception.getError());
        assertTrue(stored(first.getAccessToken()).isRevoked());
        assertTrue(stored(second.getAccessToken()).isRevoked());
        assertTrue(stored(second.getRefreshToken()).isRevoked());
        assertEquals(1, fixture.auditSink.count(AuditEvent.EventType.REFRESH_TOKEN_REUSE_DETECTED));

        // The legitimate holder is locked out as well
        assertThrows(OAuthException.class, () -> tokenIssuer.issueForRefreshToken(c1, second.getRefreshToken(), null));
    }

    @Test
    void issueForRefreshToken_expiredTokenFails() {
        TokenResponse first = exchangeCode("read");
        fixture.clock.advance(Duration.ofDays(31));

        OAuthException exception = assertThrows(OAuthException.class,
                () -> tokenIssuer.issueForRefreshToken(c1, first.getRefreshToken(), null));

        assertEquals(OAuthError.INVALID_GRANT, exception.getError());
    }

    @Test
    void issueForRefreshToken_accessTokenIsNotAccepted() {
        TokenResponse first = exchangeCode("read");

        assertThrows(OAuthException.class, () -> tokenIssuer.issueForRefreshToken(c1, first.getAccessToken(), null));
    }

    @Test
    void issueForRefreshToken_tokenOfAnotherClientFails() {
        OAuthClient other = fixture.confidentialClient("c2", "s3cret", List.of("read"),
                GrantType.AUTHORIZATION_CODE, GrantType.REFRESH_TOKEN);
        TokenResponse first = exchangeCode("read");

        assertThrows(OAuthException.class, () -> tokenIssuer.issueForRefreshToken(other, first.getRefreshToken(), null));
        assertFalse(stored(first.getRefreshToken()).isRevoked());
    }

    @Test
    void issueForRefreshToken_concurrentCallersExactlyOneWins() throws Exception {
        TokenResponse first = exchangeCode("read");
        int callers = 16;
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger successes = new AtomicInteger();
        AtomicInteger invalidGrants = new AtomicInteger();
        AtomicReference<TokenResponse> winner = new AtomicReference<>();

        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    try {
                        winner.set(tokenIssuer.issueForRefreshToken(c1, first.getRefreshToken(), null));
                        successes.incrementAndGet();
                    } catch (OAuthException e) {
                        if (e.getError() == OAuthError.INVALID_GRANT) {
                            invalidGrants.incrementAndGet();
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, successes.get());
        assertEquals(callers - 1, invalidGrants.get());
        assertTrue(fixture.auditSink.count(AuditEvent.EventType.REFRESH_TOKEN_REUSE_DETECTED) >= 1);

        // The losers' reuse detection takes down the whole family, including the winner's new pair
        String familyId = stored(first.getRefreshToken()).getFamilyId();
        List<OAuthToken> family = fixture.tokens.findAll().stream()
                .filter(token -> familyId.equals(token.getFamilyId()))
                .toList();
        assertTrue(family.size() >= 4);
        assertTrue(family.stream().allMatch(OAuthToken::isRevoked));
        assertFalse(stored(winner.get().getAccessToken()).isActive(fixture.now()));
        assertThrows(OAuthException.class,
                () -> tokenIssuer.issueForRefreshToken(c1, winner.get().getRefreshToken(), null));
    }
}
