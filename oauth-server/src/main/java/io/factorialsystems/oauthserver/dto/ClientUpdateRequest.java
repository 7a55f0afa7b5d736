package io.factorialsystems.oauthserver.dto;

import jakarta.validation.constraints.Size;
import lombok.*;

import java.util.List;

/**
 * Partial update; null fields are left unchanged.
 */
@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ClientUpdateRequest {

    @Size(max = 255, message = "Client name must be at most 255 characters")
    private String clientName;

    private List<String> redirectUris;

    private List<String> scopes;

    private Boolean isAutoApprove;
}
