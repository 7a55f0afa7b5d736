package io.factorialsystems.oauthserver.controller;

import io.factorialsystems.oauthserver.dto.IntrospectionResponse;
import io.factorialsystems.oauthserver.exception.OAuthException;
import io.factorialsystems.oauthserver.security.ClientCredentials;
import io.factorialsystems.oauthserver.security.ClientCredentialsExtractor;
import io.factorialsystems.oauthserver.service.IntrospectionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class IntrospectionController {

    private final ClientCredentialsExtractor credentialsExtractor;
    private final IntrospectionService introspectionService;

    /**
     * The caller must authenticate with HTTP Basic.
     */
    @PostMapping(value = "/introspect", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<IntrospectionResponse> introspect(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestParam(value = "token", required = false) String token,
            @RequestParam(value = "token_type_hint", required = false) String tokenTypeHint) {

        ClientCredentials credentials = credentialsExtractor.extractBasic(authorization)
                .orElseThrow(OAuthException::invalidClient);

        return ResponseEntity.ok()
                .cacheControl(CacheControl.noStore())
                .body(introspectionService.introspect(credentials, token, tokenTypeHint));
    }
}
