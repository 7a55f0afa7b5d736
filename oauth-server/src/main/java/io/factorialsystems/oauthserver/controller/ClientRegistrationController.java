package io.factorialsystems.oauthserver.controller;

import io.factorialsystems.oauthserver.dto.ClientRegistrationRequest;
import io.factorialsystems.oauthserver.dto.ClientRegistrationResponse;
import io.factorialsystems.oauthserver.security.AuthenticatedUsers;
import io.factorialsystems.oauthserver.service.DynamicClientRegistrar;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

/**
 * Dynamic client registration. Creating a client needs a logged-in user holding the registration
 * permission; reading and deleting it afterwards uses the registration access token.
 */
@Slf4j
@RestController
@RequestMapping("/register")
@RequiredArgsConstructor
public class ClientRegistrationController {

    private static final String BEARER_PREFIX = "Bearer ";

    private final DynamicClientRegistrar clientRegistrar;

    @PostMapping
    public ResponseEntity<ClientRegistrationResponse> register(@Valid @RequestBody ClientRegistrationRequest request,
                                                               Authentication authentication) {
        log.debug("Client registration request for {} with {} redirect URIs", request.getClientName(),
                request.getRedirectUris() != null ? request.getRedirectUris().size() : 0);

        ClientRegistrationResponse response = clientRegistrar.register(request, AuthenticatedUsers.userId(authentication));
        return ResponseEntity.status(HttpStatus.CREATED)
                .cacheControl(CacheControl.noStore())
                .header(HttpHeaders.LOCATION, response.getRegistrationClientUri())
                .body(response);
    }

    @GetMapping("/{clientId}")
    public ResponseEntity<ClientRegistrationResponse> read(
            @PathVariable String clientId,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        return ResponseEntity.ok()
                .cacheControl(CacheControl.noStore())
                .body(clientRegistrar.read(clientId, bearerToken(authorization)));
    }

    @DeleteMapping("/{clientId}")
    public ResponseEntity<Void> deregister(
            @PathVariable String clientId,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        clientRegistrar.deregister(clientId, bearerToken(authorization));
        return ResponseEntity.noContent().build();
    }

    private static String bearerToken(String authorization) {
        if (authorization == null || !authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return null;
        }
        return authorization.substring(BEARER_PREFIX.length()).trim();
    }
}
