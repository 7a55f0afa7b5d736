package io.factorialsystems.oauthserver.controller;

import io.factorialsystems.oauthserver.config.OAuthServerProperties;
import io.factorialsystems.oauthserver.model.GrantType;
import io.factorialsystems.oauthserver.model.TokenEndpointAuthMethod;
import io.factorialsystems.oauthserver.service.PkceVerifier;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * RFC 8414 authorization server metadata.
 */
@RestController
@RequiredArgsConstructor
public class DiscoveryController {

    private final OAuthServerProperties properties;

    @GetMapping("/.well-known/oauth-authorization-server")
    public Map<String, Object> metadata() {
        String issuer = properties.getIssuer();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("issuer", issuer);
        metadata.put("authorization_endpoint", issuer + "/authorize");
        metadata.put("token_endpoint", issuer + "/token");
        metadata.put("introspection_endpoint", issuer + "/introspect");
        metadata.put("revocation_endpoint", issuer + "/revoke");
        metadata.put("registration_endpoint", issuer + "/register");
        metadata.put("response_types_supported", List.of("code"));
        metadata.put("grant_types_supported", Arrays.stream(GrantType.values())
                .map(GrantType::getValue)
                .collect(Collectors.toList()));
        metadata.put("token_endpoint_auth_methods_supported", Arrays.stream(TokenEndpointAuthMethod.values())
                .map(TokenEndpointAuthMethod::getValue)
                .collect(Collectors.toList()));
        metadata.put("introspection_endpoint_auth_methods_supported", List.of(TokenEndpointAuthMethod.CLIENT_SECRET_BASIC.getValue()));
        metadata.put("revocation_endpoint_auth_methods_supported", Arrays.stream(TokenEndpointAuthMethod.values())
                .map(TokenEndpointAuthMethod::getValue)
                .collect(Collectors.toList()));
        metadata.put("code_challenge_methods_supported", List.of(PkceVerifier.S256));
        metadata.put("scopes_supported", properties.getRegistration().getAllowedScopes());
        return metadata;
    }
}
