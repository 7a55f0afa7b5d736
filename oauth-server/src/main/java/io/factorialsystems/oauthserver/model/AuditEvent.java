package io.factorialsystems.oauthserver.model;

import lombok.*;

import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Audit trail entry for grant, token and client lifecycle events.
 * Security events (replays, reuse, failed client authentication) are routed separately
 * so that alerting can subscribe to them alone.
 */
@Getter
@Setter
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditEvent {

    public enum EventType {
        CLIENT_AUTHENTICATION_FAILED(true),
        AUTHORIZATION_CODE_ISSUED(false),
        AUTHORIZATION_DENIED(false),
        TOKEN_ISSUED(false),
        TOKEN_REFRESHED(false),
        TOKEN_REVOKED(false),
        CODE_REPLAY_DETECTED(true),
        REFRESH_TOKEN_REUSE_DETECTED(true),
        CLIENT_REGISTERED(false),
        CLIENT_UPDATED(false),
        CLIENT_DISABLED(false),
        CLIENT_ENABLED(false),
        CLIENT_SECRET_ROTATED(false);

        private final boolean security;

        EventType(boolean security) {
            this.security = security;
        }

        public boolean isSecurity() {
            return security;
        }
    }

    private String id;
    private EventType eventType;
    private String clientId;
    private String userId;
    private String description;
    private Map<String, Object> additionalData;
    private OffsetDateTime createdAt;

    public boolean isSecurityEvent() {
        return eventType != null && eventType.isSecurity();
    }

    public static AuditEvent of(EventType eventType, String clientId, String userId, String description) {
        return AuditEvent.builder()
                .id(UUID.randomUUID().toString())
                .eventType(eventType)
                .clientId(clientId)
                .userId(userId)
                .description(description)
                .additionalData(new HashMap<>())
                .createdAt(OffsetDateTime.now())
                .build();
    }

    public static AuditEvent clientAuthenticationFailed(String clientId, String reason) {
        AuditEvent event = of(EventType.CLIENT_AUTHENTICATION_FAILED, clientId, null,
                "Client authentication failed");
        event.getAdditionalData().put("failure_reason", reason);
        return event;
    }

    public static AuditEvent tokenIssued(String clientId, String userId, GrantType grantType, List<String> scopes) {
        AuditEvent event = of(EventType.TOKEN_ISSUED, clientId, userId, "Access token issued");
        event.getAdditionalData().put("grant_type", grantType.getValue());
        event.getAdditionalData().put("scope", String.join(" ", scopes));
        return event;
    }

    public static AuditEvent codeReplayDetected(String clientId, String userId, String codeId, int revokedTokens) {
        AuditEvent event = of(EventType.CODE_REPLAY_DETECTED, clientId, userId,
                "Authorization code presented more than once");
        event.getAdditionalData().put("authorization_code_id", codeId);
        event.getAdditionalData().put("revoked_tokens", revokedTokens);
        return event;
    }

    public static AuditEvent refreshTokenReuseDetected(String clientId, String userId, String familyId, int revokedTokens) {
        AuditEvent event = of(EventType.REFRESH_TOKEN_REUSE_DETECTED, clientId, userId,
                "Rotated refresh token presented again");
        event.getAdditionalData().put("family_id", familyId);
        event.getAdditionalData().put("revoked_tokens", revokedTokens);
        return event;
    }

    public static AuditEvent tokenRevoked(String clientId, String userId, TokenType tokenType, int revokedTokens) {
        AuditEvent event = of(EventType.TOKEN_REVOKED, clientId, userId, "Token revoked by client");
        event.getAdditionalData().put("token_type", tokenType.getHint());
        event.getAdditionalData().put("revoked_tokens", revokedTokens);
        return event;
    }
}
