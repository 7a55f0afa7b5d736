package io.factorialsystems.oauthserver.security;

import io.factorialsystems.oauthserver.model.TokenEndpointAuthMethod;

/**
 * Client identification as presented on one request, before authentication.
 */
public record ClientCredentials(String clientId, String clientSecret, TokenEndpointAuthMethod authMethod) {

    public static ClientCredentials basic(String clientId, String clientSecret) {
        return new ClientCredentials(clientId, clientSecret, TokenEndpointAuthMethod.CLIENT_SECRET_BASIC);
    }

    public static ClientCredentials post(String clientId, String clientSecret) {
        return new ClientCredentials(clientId, clientSecret, TokenEndpointAuthMethod.CLIENT_SECRET_POST);
    }

    public static ClientCredentials none(String clientId) {
        return new ClientCredentials(clientId, null, TokenEndpointAuthMethod.NONE);
    }

    public boolean hasSecret() {
        return clientSecret != null && !clientSecret.isEmpty();
    }

    @Override
    public String toString() {
        return "ClientCredentials{clientId='" + clientId + "', authMethod=" + authMethod + "}";
    }
}
