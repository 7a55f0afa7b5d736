package io.factorialsystems.oauthserver.service;

import io.factorialsystems.oauthserver.dto.AuthorizationRequest;
import io.factorialsystems.oauthserver.dto.AuthorizationResult;
import io.factorialsystems.oauthserver.dto.ConsentDescriptor;
import io.factorialsystems.oauthserver.dto.IssuedAuthorizationCode;
import io.factorialsystems.oauthserver.exception.OAuthError;
import io.factorialsystems.oauthserver.exception.OAuthException;
import io.factorialsystems.oauthserver.model.AuditEvent;
import io.factorialsystems.oauthserver.model.GrantType;
import io.factorialsystems.oauthserver.model.OAuthClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.core.endpoint.OAuth2ParameterNames;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Decides {@code /authorize} requests for an authenticated user.
 * <p>
 * Until client and redirect URI are known to match, errors are thrown and rendered by the server
 * itself. After that, every error travels back to the client as redirect parameters.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthorizationService {

    private static final String RESPONSE_TYPE_CODE = "code";

    private final ClientRegistry clientRegistry;
    private final CodeIssuer codeIssuer;
    private final AuditSink auditSink;

    public AuthorizationResult authorize(AuthorizationRequest request, String userId) {
        OAuthClient client = resolveClient(request);

        AuthorizationResult error = validate(request, client);
        if (error != null) {
            return error;
        }

        List<String> scopes = requestedScopes(request, client);

        if (client.isAutoApproveClient()) {
            log.info("Auto-approving authorization for client {} and user {}", client.getClientId(), userId);
            return AuthorizationResult.redirect(issueCode(request, client, userId, scopes));
        }

        return AuthorizationResult.consentRequired(ConsentDescriptor.builder()
                .clientId(client.getClientId())
                .clientName(client.getClientName() != null ? client.getClientName() : client.getClientId())
                .scopes(scopes)
                .redirectUri(request.getRedirectUri())
                .state(request.getState())
                .build());
    }

    /**
     * Applies the user's consent decision and returns the redirect back to the client.
     *
     * @param approvedScope optional narrowing of the requested scope
     */
    public String decide(AuthorizationRequest request, String userId, boolean approved, String approvedScope) {
        OAuthClient client = resolveClient(request);

        AuthorizationResult error = validate(request, client);
        if (error != null) {
            return error.redirectUri();
        }

        if (!approved) {
            log.info("User {} denied authorization for client {}", userId, client.getClientId());
            auditSink.record(AuditEvent.of(AuditEvent.EventType.AUTHORIZATION_DENIED, client.getClientId(), userId,
                    "User denied the authorization request"));
            return errorRedirect(request, OAuthError.ACCESS_DENIED, "The user denied the request");
        }

        List<String> requested = requestedScopes(request, client);
        List<String> scopes = requested;
        Set<String> narrowed = Scopes.parse(approvedScope);
        if (!narrowed.isEmpty()) {
            if (!Scopes.isSubset(narrowed, requested)) {
                return errorRedirect(request, OAuthError.INVALID_SCOPE, "Approved scope exceeds the requested scope");
            }
            scopes = new ArrayList<>(narrowed);
        }

        return issueCode(request, client, userId, scopes);
    }

    private OAuthClient resolveClient(AuthorizationRequest request) {
        OAuthClient client = clientRegistry.resolve(request.getClientId())
                .filter(OAuthClient::isEnabledClient)
                .orElseThrow(() -> OAuthException.invalidRequest("Unknown or disabled client"));

        if (request.getRedirectUri() == null || !clientRegistry.supportsRedirect(client, request.getRedirectUri())) {
            log.warn("Authorization request for client {} with unregistered redirect_uri {}",
                    client.getClientId(), request.getRedirectUri());
            throw OAuthException.invalidRequest("redirect_uri is missing or not registered for this client");
        }
        return client;
    }

    private AuthorizationResult validate(AuthorizationRequest request, OAuthClient client) {
        if (!RESPONSE_TYPE_CODE.equals(request.getResponseType())) {
            return errorResult(request, OAuthError.UNSUPPORTED_RESPONSE_TYPE, "Only response_type=code is supported");
        }

        if (!clientRegistry.supportsGrant(client, GrantType.AUTHORIZATION_CODE)) {
            return errorResult(request, OAuthError.UNAUTHORIZED_CLIENT,
                    "Client is not authorized for the authorization_code grant");
        }

        if (!Scopes.isSubset(Scopes.parse(request.getScope()), client.getScopes())) {
            return errorResult(request, OAuthError.INVALID_SCOPE, "Requested scope is not allowed for this client");
        }

        if (request.getCodeChallenge() != null) {
            if (!PkceVerifier.isSupportedMethod(request.getCodeChallengeMethod())) {
                return errorResult(request, OAuthError.INVALID_REQUEST, "code_challenge_method must be S256");
            }
            if (!PkceVerifier.isWellFormedChallenge(request.getCodeChallenge())) {
                return errorResult(request, OAuthError.INVALID_REQUEST, "Malformed code_challenge");
            }
        } else if (client.isPublicClient()) {
            return errorResult(request, OAuthError.INVALID_REQUEST, "Public clients must use PKCE");
        }
        return null;
    }

    private List<String> requestedScopes(AuthorizationRequest request, OAuthClient client) {
        Set<String> requested = Scopes.parse(request.getScope());
        return requested.isEmpty() ? new ArrayList<>(client.getScopes()) : new ArrayList<>(requested);
    }

    private String issueCode(AuthorizationRequest request, OAuthClient client, String userId, List<String> scopes) {
        IssuedAuthorizationCode code = codeIssuer.issue(client, userId, request.getRedirectUri(), scopes,
                request.getCodeChallenge(), request.getCodeChallengeMethod());

        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(request.getRedirectUri());
        addQueryParam(builder, OAuth2ParameterNames.CODE, code.code());
        addQueryParam(builder, OAuth2ParameterNames.STATE, request.getState());
        return builder.build(true).toUriString();
    }

    private AuthorizationResult errorResult(AuthorizationRequest request, OAuthError error, String description) {
        log.debug("Authorization request for client {} rejected with {}", request.getClientId(), error.getCode());
        return AuthorizationResult.redirect(errorRedirect(request, error, description));
    }

    private String errorRedirect(AuthorizationRequest request, OAuthError error, String description) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(request.getRedirectUri());
        addQueryParam(builder, OAuth2ParameterNames.ERROR, error.getCode());
        addQueryParam(builder, OAuth2ParameterNames.ERROR_DESCRIPTION, description);
        addQueryParam(builder, OAuth2ParameterNames.STATE, request.getState());
        return builder.build(true).toUriString();
    }

    // Registered redirect URIs are already valid URIs; only the added values need encoding
    private static void addQueryParam(UriComponentsBuilder builder, String name, String value) {
        if (value != null) {
            builder.queryParam(name, UriUtils.encodeQueryParam(value, StandardCharsets.UTF_8));
        }
    }
}
