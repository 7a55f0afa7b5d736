package io.factorialsystems.oauthserver.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.*;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ToString(exclude = {"clientSecretHash", "registrationAccessTokenHash"})
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class OAuthClient {
    private String id;
    private String clientId;
    private String clientSecretHash;
    private String clientName;
    private Boolean isConfidential;
    private Boolean isEnabled;
    private Boolean isAutoApprove;
    private TokenEndpointAuthMethod tokenEndpointAuthMethod;

    @Builder.Default
    private List<String> redirectUris = new ArrayList<>();

    @Builder.Default
    private List<String> grantTypes = new ArrayList<>();

    @Builder.Default
    private List<String> scopes = new ArrayList<>();

    private String registrationAccessTokenHash;
    private String createdBy;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;

    public boolean isConfidentialClient() {
        return Boolean.TRUE.equals(isConfidential);
    }

    public boolean isPublicClient() {
        return !isConfidentialClient();
    }

    public boolean isEnabledClient() {
        return Boolean.TRUE.equals(isEnabled);
    }

    public boolean isAutoApproveClient() {
        return Boolean.TRUE.equals(isAutoApprove);
    }

    public boolean supportsGrant(GrantType grantType) {
        return grantTypes != null && grantTypes.contains(grantType.getValue());
    }

    /**
     * Exact string comparison only; prefix or pattern matching would open redirects.
     */
    public boolean hasRedirectUri(String redirectUri) {
        return redirectUri != null && redirectUris != null && redirectUris.contains(redirectUri);
    }
}
