package io.factorialsystems.oauthserver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;
import lombok.*;

import java.util.ArrayList;
import java.util.List;

/**
 * RFC 7591 client metadata accepted by {@code POST /register}.
 */
@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ClientRegistrationRequest {

    @JsonProperty("client_name")
    @Size(max = 255, message = "client_name must be at most 255 characters")
    private String clientName;

    @JsonProperty("redirect_uris")
    @Builder.Default
    private List<String> redirectUris = new ArrayList<>();

    @JsonProperty("grant_types")
    @Builder.Default
    private List<String> grantTypes = new ArrayList<>();

    @JsonProperty("token_endpoint_auth_method")
    private String tokenEndpointAuthMethod;

    private String scope;
}
