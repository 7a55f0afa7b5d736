package io.factorialsystems.oauthserver.controller;

import io.factorialsystems.oauthserver.exception.OAuthException;
import io.factorialsystems.oauthserver.security.ClientCredentials;
import io.factorialsystems.oauthserver.security.ClientCredentialsExtractor;
import io.factorialsystems.oauthserver.service.RevocationService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequiredArgsConstructor
public class RevocationController {

    private final ClientCredentialsExtractor credentialsExtractor;
    private final RevocationService revocationService;

    /**
     * Always 200 with an empty body unless client authentication fails.
     */
    @PostMapping("/revoke")
    public ResponseEntity<Void> revoke(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestParam Map<String, String> parameters) {

        ClientCredentials credentials = credentialsExtractor.extract(authorization, parameters)
                .orElseThrow(OAuthException::invalidClient);

        revocationService.revoke(credentials, parameters.get("token"), parameters.get("token_type_hint"));
        return ResponseEntity.ok().build();
    }
}
