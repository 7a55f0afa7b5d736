package io.factorialsystems.oauthserver.service;

import io.factorialsystems.oauthserver.exception.OAuthException;
import io.factorialsystems.oauthserver.model.GrantType;
import io.factorialsystems.oauthserver.model.TokenEndpointAuthMethod;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Validation shared by dynamic registration and the admin API.
 */
@Component
public class ClientMetadataValidator {

    public List<String> validateRedirectUris(Collection<String> redirectUris) {
        if (redirectUris == null || redirectUris.isEmpty()) {
            throw OAuthException.invalidRedirectUri("At least one redirect_uri is required");
        }

        Set<String> validated = new LinkedHashSet<>();
        for (String redirectUri : redirectUris) {
            validateRedirectUri(redirectUri);
            validated.add(redirectUri);
        }
        return List.copyOf(validated);
    }

    public void validateRedirectUri(String redirectUri) {
        if (redirectUri == null || redirectUri.isBlank()) {
            throw OAuthException.invalidRedirectUri("redirect_uri must not be blank");
        }

        URI uri;
        try {
            uri = new URI(redirectUri);
        } catch (URISyntaxException e) {
            throw OAuthException.invalidRedirectUri("Malformed redirect_uri: " + redirectUri);
        }

        if (!uri.isAbsolute()) {
            throw OAuthException.invalidRedirectUri("redirect_uri must be absolute: " + redirectUri);
        }
        if (uri.getRawFragment() != null) {
            throw OAuthException.invalidRedirectUri("redirect_uri must not contain a fragment: " + redirectUri);
        }
    }

    /**
     * Defaults to authorization_code. refresh_token needs authorization_code, and client_credentials
     * needs a client that can authenticate.
     */
    public List<GrantType> validateGrantTypes(Collection<String> grantTypes, TokenEndpointAuthMethod authMethod) {
        Set<GrantType> validated = new LinkedHashSet<>();
        if (grantTypes == null || grantTypes.isEmpty()) {
            validated.add(GrantType.AUTHORIZATION_CODE);
        } else {
            for (String value : grantTypes) {
                validated.add(GrantType.fromValue(value)
                        .orElseThrow(() -> OAuthException.invalidClientMetadata("Unsupported grant type: " + value)));
            }
        }

        if (validated.contains(GrantType.REFRESH_TOKEN) && !validated.contains(GrantType.AUTHORIZATION_CODE)) {
            throw OAuthException.invalidClientMetadata("refresh_token requires the authorization_code grant");
        }
        if (validated.contains(GrantType.CLIENT_CREDENTIALS) && authMethod == TokenEndpointAuthMethod.NONE) {
            throw OAuthException.invalidClientMetadata("client_credentials requires a confidential client");
        }
        return List.copyOf(validated);
    }

    public TokenEndpointAuthMethod validateAuthMethod(String value) {
        if (value == null || value.isBlank()) {
            return TokenEndpointAuthMethod.CLIENT_SECRET_BASIC;
        }
        return TokenEndpointAuthMethod.fromValue(value)
                .orElseThrow(() -> OAuthException.invalidClientMetadata("Unsupported token_endpoint_auth_method: " + value));
    }

    /**
     * Requested scopes, or {@code defaults} when none were requested; all must be in {@code allowed}.
     */
    public List<String> validateScopes(String scope, Collection<String> allowed, Collection<String> defaults) {
        Set<String> requested = Scopes.parse(scope);
        if (requested.isEmpty()) {
            return List.copyOf(defaults);
        }
        if (!Scopes.isSubset(requested, allowed)) {
            throw OAuthException.invalidClientMetadata("Requested scope is not allowed: " + Scopes.format(requested));
        }
        return List.copyOf(requested);
    }
}
