package io.factorialsystems.oauthserver.service;

import io.factorialsystems.oauthserver.dto.ClientRegistrationRequest;
import io.factorialsystems.oauthserver.dto.ClientRegistrationResponse;
import io.factorialsystems.oauthserver.dto.TokenResponse;
import io.factorialsystems.oauthserver.exception.OAuthError;
import io.factorialsystems.oauthserver.exception.OAuthException;
import io.factorialsystems.oauthserver.model.AuditEvent;
import io.factorialsystems.oauthserver.model.OAuthClient;
import io.factorialsystems.oauthserver.model.OAuthToken;
import io.factorialsystems.oauthserver.support.OAuthTestFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.factorialsystems.oauthserver.support.OAuthTestFixture.REDIRECT_URI;
import static io.factorialsystems.oauthserver.support.OAuthTestFixture.basic;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verify;

class DynamicClientRegistrarTest {

    private OAuthTestFixture fixture;
    private DynamicClientRegistrar registrar;

    @BeforeEach
    void setUp() {
        fixture = new OAuthTestFixture();
        registrar = fixture.clientRegistrar;
        fixture.user("dev", "developer", "oauth:client:register");
        fixture.user("guest", "guest");
    }

    private static ClientRegistrationRequest request(String authMethod, String... grantTypes) {
        return ClientRegistrationRequest.builder()
                .clientName("Reporting tool")
                .redirectUris(List.of(REDIRECT_URI))
                .grantTypes(List.of(grantTypes))
                .tokenEndpointAuthMethod(authMethod)
                .build();
    }

    @Test
    void register_confidentialClientReceivesSecretAndManagementToken() {
        ClientRegistrationResponse response = registrar.register(
                request(null, "authorization_code", "refresh_token"), "dev");

        assertNotNull(response.getClientId());
        assertNotNull(response.getClientSecret());
        assertNotNull(response.getRegistrationAccessToken());
        assertEquals(0L, response.getClientSecretExpiresAt());
        assertEquals("client_secret_basic", response.getTokenEndpointAuthMethod());
        assertEquals("read", response.getScope());
        assertEquals(fixture.properties.getIssuer() + "/register/" + response.getClientId(),
                response.getRegistrationClientUri());
        assertEquals(1, fixture.auditSink.count(AuditEvent.EventType.CLIENT_REGISTERED));

        OAuthClient stored = fixture.client(response.getClientId());
        assertNotEquals(response.getClientSecret(), stored.getClientSecretHash());
        assertEquals(fixture.tokenGenerator.hash(response.getRegistrationAccessToken()),
                stored.getRegistrationAccessTokenHash());
        assertEquals("dev", stored.getCreatedBy());
    }

    @Test
    void register_issuedSecretAuthenticates() {
        ClientRegistrationResponse response = registrar.register(request(null), "dev");

        OAuthClient client = fixture.clientRegistry.authenticate(
                basic(response.getClientId(), response.getClientSecret()));

        assertEquals(response.getClientId(), client.getClientId());
    }

    @Test
    void register_publicClientHasNoSecret() {
        ClientRegistrationResponse response = registrar.register(request("none"), "dev");

        assertNull(response.getClientSecret());
        assertNull(response.getClientSecretExpiresAt());
        assertTrue(fixture.client(response.getClientId()).isPublicClient());
    }

    @Test
    void register_requiresPermission() {
        OAuthException exception = assertThrows(OAuthException.class,
                () -> registrar.register(request(null), "guest"));

        assertEquals(OAuthError.ACCESS_DENIED, exception.getError());
        assertTrue(fixture.clients.findAll().isEmpty());
    }

    @Test
    void register_rejectsScopeOutsideAllowedSet() {
        ClientRegistrationRequest request = request(null);
        request.setScope("read admin");

        OAuthException exception = assertThrows(OAuthException.class, () -> registrar.register(request, "dev"));

        assertEquals(OAuthError.INVALID_CLIENT_METADATA, exception.getError());
    }

    @Test
    void register_rejectsFragmentInRedirectUri() {
        ClientRegistrationRequest request = request(null);
        request.setRedirectUris(List.of("https://app/cb#frag"));

        OAuthException exception = assertThrows(OAuthException.class, () -> registrar.register(request, "dev"));

        assertEquals(OAuthError.INVALID_REDIRECT_URI, exception.getError());
    }

    @Test
    void register_rejectsClientCredentialsForPublicClient() {
        OAuthException exception = assertThrows(OAuthException.class,
                () -> registrar.register(request("none", "client_credentials"), "dev"));

        assertEquals(OAuthError.INVALID_CLIENT_METADATA, exception.getError());
    }

    @Test
    void read_requiresTheRegistrationAccessToken() {
        ClientRegistrationResponse registered = registrar.register(request(null), "dev");

        ClientRegistrationResponse read = registrar.read(registered.getClientId(), registered.getRegistrationAccessToken());
        assertEquals(registered.getClientId(), read.getClientId());
        assertNull(read.getClientSecret());
        assertNull(read.getRegistrationAccessToken());

        OAuthException exception = assertThrows(OAuthException.class,
                () -> registrar.read(registered.getClientId(), "not-the-token"));
        assertEquals(OAuthError.INVALID_TOKEN, exception.getError());
    }

    @Test
    void read_tokenOfAnotherClientIsRejected() {
        ClientRegistrationResponse first = registrar.register(request(null), "dev");
        ClientRegistrationResponse second = registrar.register(request(null), "dev");

        assertThrows(OAuthException.class,
                () -> registrar.read(first.getClientId(), second.getRegistrationAccessToken()));
    }

    @Test
    void deregister_disablesClientAndRevokesItsTokens() {
        ClientRegistrationResponse registered = registrar.register(
                request(null, "authorization_code", "refresh_token"), "dev");
        OAuthClient client = fixture.client(registered.getClientId());
        String code = fixture.issueCode(client.getClientId(), "dev", "read").code();
        TokenResponse tokens = fixture.tokenIssuer.issueForAuthCode(client, code, REDIRECT_URI, null);
        assertNotNull(tokens.getRefreshToken());

        registrar.deregister(registered.getClientId(), registered.getRegistrationAccessToken());

        assertFalse(fixture.client(registered.getClientId()).isEnabledClient());
        assertTrue(fixture.tokens.findAll().stream().allMatch(OAuthToken::isRevoked));
        verify(fixture.clientCache).evictClient(registered.getClientId());
        assertEquals(1, fixture.auditSink.count(AuditEvent.EventType.CLIENT_DISABLED));

        OAuthException exception = assertThrows(OAuthException.class,
                () -> fixture.clientRegistry.authenticate(basic(registered.getClientId(), registered.getClientSecret())));
        assertEquals(OAuthError.INVALID_CLIENT, exception.getError());
    }

    @Test
    void deregister_withoutTokenIsInvalidToken() {
        ClientRegistrationResponse registered = registrar.register(request(null), "dev");

        OAuthException exception = assertThrows(OAuthException.class,
                () -> registrar.deregister(registered.getClientId(), null));

        assertEquals(OAuthError.INVALID_TOKEN, exception.getError());
        assertTrue(fixture.client(registered.getClientId()).isEnabledClient());
    }
}
