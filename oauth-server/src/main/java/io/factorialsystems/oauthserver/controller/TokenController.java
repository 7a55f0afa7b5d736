package io.factorialsystems.oauthserver.controller;

import io.factorialsystems.oauthserver.dto.TokenResponse;
import io.factorialsystems.oauthserver.exception.OAuthException;
import io.factorialsystems.oauthserver.service.GrantStateMachine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequiredArgsConstructor
public class TokenController {

    private final GrantStateMachine grantStateMachine;

    @PostMapping(value = "/token", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<TokenResponse> tokenFromForm(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestParam MultiValueMap<String, String> parameters) {

        Map<String, String> singleValued = new HashMap<>();
        for (Map.Entry<String, List<String>> entry : parameters.entrySet()) {
            if (entry.getValue().size() > 1) {
                throw OAuthException.invalidRequest("Parameter " + entry.getKey() + " must not be repeated");
            }
            singleValued.put(entry.getKey(), entry.getValue().get(0));
        }
        return issue(authorization, singleValued);
    }

    @PostMapping(value = "/token", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<TokenResponse> tokenFromJson(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody Map<String, String> parameters) {
        return issue(authorization, parameters);
    }

    private ResponseEntity<TokenResponse> issue(String authorization, Map<String, String> parameters) {
        log.debug("Token request with grant_type={}", parameters.get("grant_type"));
        TokenResponse response = grantStateMachine.handle(authorization, parameters);

        return ResponseEntity.ok()
                .cacheControl(CacheControl.noStore())
                .header(HttpHeaders.PRAGMA, "no-cache")
                .body(response);
    }
}
