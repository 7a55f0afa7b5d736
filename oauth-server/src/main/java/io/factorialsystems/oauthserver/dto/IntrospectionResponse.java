package io.factorialsystems.oauthserver.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

/**
 * RFC 7662 introspection response. Inactive tokens carry nothing but {@code active:false}.
 */
@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IntrospectionResponse {

    private boolean active;

    private String scope;

    @JsonProperty("client_id")
    private String clientId;

    private String sub;

    private String username;

    @JsonProperty("token_type")
    private String tokenType;

    private Long exp;

    private Long iat;

    private String iss;

    public static IntrospectionResponse inactive() {
        return IntrospectionResponse.builder().active(false).build();
    }

    public static IntrospectionResponse activeOnly() {
        return IntrospectionResponse.builder().active(true).build();
    }
}
