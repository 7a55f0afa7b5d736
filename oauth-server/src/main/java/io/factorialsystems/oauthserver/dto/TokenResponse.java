package io.factorialsystems.oauthserver.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TokenResponse {

    public static final String BEARER = "Bearer";

    @JsonProperty("access_token")
    private String accessToken;

    @JsonProperty("token_type")
    @Builder.Default
    private String tokenType = BEARER;

    @JsonProperty("expires_in")
    private Long expiresIn;

    @JsonProperty("refresh_token")
    private String refreshToken;

    private String scope;

    @Override
    public String toString() {
        return "TokenResponse{tokenType='" + tokenType + "', expiresIn=" + expiresIn
                + ", refreshToken=" + (refreshToken != null ? "[present]" : "none")
                + ", scope='" + scope + "'}";
    }
}
