package io.factorialsystems.oauthserver.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.time.OffsetDateTime;
import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ClientResponse {
    private String clientId;
    private String clientName;
    private Boolean isConfidential;
    private Boolean isEnabled;
    private Boolean isAutoApprove;
    private String tokenEndpointAuthMethod;
    private List<String> redirectUris;
    private List<String> grantTypes;
    private List<String> scopes;
    private String createdBy;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;

    // Only set when a secret was just generated; never readable again
    private String clientSecret;
}
