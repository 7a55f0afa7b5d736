package io.factorialsystems.oauthserver.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.*;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ClientCreateRequest {

    @NotBlank(message = "Client name is required")
    @Size(max = 255, message = "Client name must be at most 255 characters")
    private String clientName;

    @Builder.Default
    private List<String> redirectUris = new ArrayList<>();

    @Builder.Default
    private List<String> grantTypes = new ArrayList<>();

    @NotEmpty(message = "At least one scope is required")
    @Builder.Default
    private List<String> scopes = new ArrayList<>();

    // client_secret_basic when absent
    private String tokenEndpointAuthMethod;

    private Boolean isAutoApprove;
}
