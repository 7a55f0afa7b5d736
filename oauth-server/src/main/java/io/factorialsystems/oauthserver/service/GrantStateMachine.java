package io.factorialsystems.oauthserver.service;

import io.factorialsystems.oauthserver.dto.TokenResponse;
import io.factorialsystems.oauthserver.exception.OAuthException;
import io.factorialsystems.oauthserver.model.GrantType;
import io.factorialsystems.oauthserver.model.OAuthClient;
import io.factorialsystems.oauthserver.security.ClientCredentials;
import io.factorialsystems.oauthserver.security.ClientCredentialsExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.core.endpoint.OAuth2ParameterNames;
import org.springframework.security.oauth2.core.endpoint.PkceParameterNames;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Token endpoint dispatch. Checks run in a fixed order so that the error a caller sees does not
 * depend on which grant it asked for: grant_type present, client identified, request well formed,
 * client authenticated, grant allowed for the client, then the grant itself.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GrantStateMachine {

    private final ClientCredentialsExtractor credentialsExtractor;
    private final ClientRegistry clientRegistry;
    private final TokenIssuer tokenIssuer;

    public TokenResponse handle(String authorizationHeader, Map<String, String> parameters) {
        String grantTypeValue = parameters.get(OAuth2ParameterNames.GRANT_TYPE);
        if (grantTypeValue == null || grantTypeValue.isEmpty()) {
            throw OAuthException.invalidRequest("Missing grant_type parameter");
        }

        ClientCredentials credentials = credentialsExtractor.extract(authorizationHeader, parameters)
                .orElseThrow(OAuthException::invalidClient);

        GrantType grantType = GrantType.fromValue(grantTypeValue)
                .orElseThrow(() -> OAuthException.unsupportedGrantType(grantTypeValue));

        for (String parameter : requiredParameters(grantType)) {
            String value = parameters.get(parameter);
            if (value == null || value.isEmpty()) {
                throw OAuthException.invalidRequest("Missing " + parameter + " parameter");
            }
        }

        OAuthClient client = clientRegistry.authenticate(credentials);

        if (!clientRegistry.supportsGrant(client, grantType)) {
            log.warn("Client {} is not allowed the {} grant", client.getClientId(), grantType.getValue());
            throw OAuthException.unauthorizedClient("Client is not authorized for grant type " + grantType.getValue());
        }

        return switch (grantType) {
            case AUTHORIZATION_CODE -> tokenIssuer.issueForAuthCode(client,
                    parameters.get(OAuth2ParameterNames.CODE),
                    parameters.get(OAuth2ParameterNames.REDIRECT_URI),
                    parameters.get(PkceParameterNames.CODE_VERIFIER));
            case CLIENT_CREDENTIALS -> {
                if (client.isPublicClient()) {
                    throw OAuthException.unauthorizedClient("Public clients cannot use the client_credentials grant");
                }
                yield tokenIssuer.issueForClientCredentials(client, parameters.get(OAuth2ParameterNames.SCOPE));
            }
            case REFRESH_TOKEN -> tokenIssuer.issueForRefreshToken(client,
                    parameters.get(OAuth2ParameterNames.REFRESH_TOKEN),
                    parameters.get(OAuth2ParameterNames.SCOPE));
        };
    }

    private static List<String> requiredParameters(GrantType grantType) {
        return switch (grantType) {
            case AUTHORIZATION_CODE -> List.of(OAuth2ParameterNames.CODE, OAuth2ParameterNames.REDIRECT_URI);
            case CLIENT_CREDENTIALS -> List.of();
            case REFRESH_TOKEN -> List.of(OAuth2ParameterNames.REFRESH_TOKEN);
        };
    }
}
