package io.factorialsystems.oauthserver.security;

import io.factorialsystems.oauthserver.exception.OAuthException;
import org.springframework.security.oauth2.core.endpoint.OAuth2ParameterNames;
import org.springframework.stereotype.Component;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import java.util.Optional;

/**
 * Reads client credentials from an {@code Authorization: Basic} header or from the
 * {@code client_id}/{@code client_secret} body parameters. The header wins when both are present.
 */
@Component
public class ClientCredentialsExtractor {

    private static final String BASIC_PREFIX = "Basic ";

    /**
     * @return empty when the request identifies no client at all
     */
    public Optional<ClientCredentials> extract(String authorizationHeader, Map<String, String> parameters) {
        if (authorizationHeader != null && !authorizationHeader.isBlank()) {
            return Optional.of(parseBasic(authorizationHeader));
        }

        String clientId = parameters.get(OAuth2ParameterNames.CLIENT_ID);
        if (clientId == null || clientId.isEmpty()) {
            return Optional.empty();
        }

        String clientSecret = parameters.get(OAuth2ParameterNames.CLIENT_SECRET);
        if (clientSecret == null || clientSecret.isEmpty()) {
            return Optional.of(ClientCredentials.none(clientId));
        }
        return Optional.of(ClientCredentials.post(clientId, clientSecret));
    }

    /**
     * Only accepts HTTP Basic; used by the introspection endpoint.
     */
    public Optional<ClientCredentials> extractBasic(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(parseBasic(authorizationHeader));
    }

    private ClientCredentials parseBasic(String header) {
        if (!header.regionMatches(true, 0, BASIC_PREFIX, 0, BASIC_PREFIX.length())) {
            throw OAuthException.invalidClient();
        }

        String decoded;
        try {
            byte[] bytes = Base64.getDecoder().decode(header.substring(BASIC_PREFIX.length()).trim());
            decoded = new String(bytes, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw OAuthException.invalidRequest("Malformed Basic authorization header");
        }

        int separator = decoded.indexOf(':');
        if (separator <= 0) {
            throw OAuthException.invalidRequest("Malformed Basic authorization header");
        }

        // RFC 6749 2.3.1: id and secret are form-urlencoded before Base64
        String clientId = URLDecoder.decode(decoded.substring(0, separator), StandardCharsets.UTF_8);
        String clientSecret = URLDecoder.decode(decoded.substring(separator + 1), StandardCharsets.UTF_8);
        return ClientCredentials.basic(clientId, clientSecret);
    }
}
