package io.factorialsystems.oauthserver.dto;

import lombok.*;

/**
 * Parameters of {@code /authorize}; the consent decision posts the same fields back.
 */
@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AuthorizationRequest {
    private String responseType;
    private String clientId;
    private String redirectUri;
    private String scope;
    private String state;
    private String codeChallenge;
    private String codeChallengeMethod;
}
