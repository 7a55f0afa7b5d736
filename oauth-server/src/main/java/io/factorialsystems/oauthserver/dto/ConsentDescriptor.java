package io.factorialsystems.oauthserver.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

import java.util.List;

/**
 * What a consent screen needs to ask the user. Rendering it is left to the front end.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConsentDescriptor {

    @JsonProperty("client_id")
    private String clientId;

    @JsonProperty("client_name")
    private String clientName;

    private List<String> scopes;

    @JsonProperty("redirect_uri")
    private String redirectUri;

    private String state;
}
