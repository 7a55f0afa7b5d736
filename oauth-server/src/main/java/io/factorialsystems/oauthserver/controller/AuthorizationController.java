package io.factorialsystems.oauthserver.controller;

import io.factorialsystems.oauthserver.dto.AuthorizationRequest;
import io.factorialsystems.oauthserver.dto.AuthorizationResult;
import io.factorialsystems.oauthserver.exception.OAuthException;
import io.factorialsystems.oauthserver.security.AuthenticatedUsers;
import io.factorialsystems.oauthserver.service.AuthorizationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

/**
 * Authorization endpoint. The user is already logged in by the default security chain.
 * A consent prompt is returned as JSON; the front end posts the decision back here.
 */
@Slf4j
@RestController
@RequestMapping("/authorize")
@RequiredArgsConstructor
public class AuthorizationController {

    private final AuthorizationService authorizationService;

    @GetMapping
    public ResponseEntity<?> authorize(
            @RequestParam(value = "response_type", required = false) String responseType,
            @RequestParam(value = "client_id", required = false) String clientId,
            @RequestParam(value = "redirect_uri", required = false) String redirectUri,
            @RequestParam(value = "scope", required = false) String scope,
            @RequestParam(value = "state", required = false) String state,
            @RequestParam(value = "code_challenge", required = false) String codeChallenge,
            @RequestParam(value = "code_challenge_method", required = false) String codeChallengeMethod,
            Authentication authentication) {

        AuthorizationRequest request = AuthorizationRequest.builder()
                .responseType(responseType)
                .clientId(clientId)
                .redirectUri(redirectUri)
                .scope(scope)
                .state(state)
                .codeChallenge(codeChallenge)
                .codeChallengeMethod(codeChallengeMethod)
                .build();

        AuthorizationResult result = authorizationService.authorize(request, requireUserId(authentication));
        if (result.isRedirect()) {
            return redirect(result.redirectUri());
        }
        return ResponseEntity.ok(result.consent());
    }

    @PostMapping
    public ResponseEntity<Void> decide(
            @RequestParam(value = "response_type", required = false) String responseType,
            @RequestParam(value = "client_id", required = false) String clientId,
            @RequestParam(value = "redirect_uri", required = false) String redirectUri,
            @RequestParam(value = "scope", required = false) String scope,
            @RequestParam(value = "state", required = false) String state,
            @RequestParam(value = "code_challenge", required = false) String codeChallenge,
            @RequestParam(value = "code_challenge_method", required = false) String codeChallengeMethod,
            @RequestParam(value = "approved", defaultValue = "false") boolean approved,
            @RequestParam(value = "approved_scope", required = false) String approvedScope,
            Authentication authentication) {

        AuthorizationRequest request = AuthorizationRequest.builder()
                .responseType(responseType)
                .clientId(clientId)
                .redirectUri(redirectUri)
                .scope(scope)
                .state(state)
                .codeChallenge(codeChallenge)
                .codeChallengeMethod(codeChallengeMethod)
                .build();

        return redirect(authorizationService.decide(request, requireUserId(authentication), approved, approvedScope));
    }

    private static String requireUserId(Authentication authentication) {
        String userId = AuthenticatedUsers.userId(authentication);
        if (userId == null) {
            throw OAuthException.accessDenied("User authentication required");
        }
        return userId;
    }

    private static <T> ResponseEntity<T> redirect(String location) {
        return ResponseEntity.status(HttpStatus.FOUND)
                .header(HttpHeaders.LOCATION, location)
                .build();
    }
}
