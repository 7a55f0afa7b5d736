package io.factorialsystems.oauthserver.controller;

import io.factorialsystems.oauthserver.dto.ClientCreateRequest;
import io.factorialsystems.oauthserver.dto.ClientResponse;
import io.factorialsystems.oauthserver.dto.ClientUpdateRequest;
import io.factorialsystems.oauthserver.security.AuthenticatedUsers;
import io.factorialsystems.oauthserver.service.ClientAdministrationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/v1/clients")
@RequiredArgsConstructor
public class ClientAdminController {

    private final ClientAdministrationService clientAdministrationService;

    @GetMapping
    public ResponseEntity<List<ClientResponse>> listClients() {
        return ResponseEntity.ok(clientAdministrationService.listClients());
    }

    @PostMapping
    public ResponseEntity<ClientResponse> createClient(@Valid @RequestBody ClientCreateRequest request,
                                                       Authentication authentication) {
        log.info("Creating OAuth client: {}", request.getClientName());
        ClientResponse response = clientAdministrationService.createClient(request, AuthenticatedUsers.userId(authentication));
        return ResponseEntity.status(HttpStatus.CREATED)
                .cacheControl(CacheControl.noStore())
                .body(response);
    }

    @GetMapping("/{clientId}")
    public ResponseEntity<ClientResponse> getClient(@PathVariable String clientId) {
        return ResponseEntity.ok(clientAdministrationService.getClient(clientId));
    }

    @PutMapping("/{clientId}")
    public ResponseEntity<ClientResponse> updateClient(@PathVariable String clientId,
                                                       @Valid @RequestBody ClientUpdateRequest request,
                                                       Authentication authentication) {
        return ResponseEntity.ok(clientAdministrationService.updateClient(clientId, request,
                AuthenticatedUsers.userId(authentication)));
    }

    @PostMapping("/{clientId}/enable")
    public ResponseEntity<ClientResponse> enableClient(@PathVariable String clientId, Authentication authentication) {
        return ResponseEntity.ok(clientAdministrationService.setEnabled(clientId, true,
                AuthenticatedUsers.userId(authentication)));
    }

    @PostMapping("/{clientId}/disable")
    public ResponseEntity<ClientResponse> disableClient(@PathVariable String clientId, Authentication authentication) {
        return ResponseEntity.ok(clientAdministrationService.setEnabled(clientId, false,
                AuthenticatedUsers.userId(authentication)));
    }

    @PostMapping("/{clientId}/secret")
    public ResponseEntity<ClientResponse> rotateSecret(@PathVariable String clientId, Authentication authentication) {
        log.info("Rotating secret for OAuth client: {}", clientId);
        return ResponseEntity.ok()
                .cacheControl(CacheControl.noStore())
                .body(clientAdministrationService.rotateSecret(clientId, AuthenticatedUsers.userId(authentication)));
    }
}
