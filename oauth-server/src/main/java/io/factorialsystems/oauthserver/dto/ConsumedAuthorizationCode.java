package io.factorialsystems.oauthserver.dto;

import java.util.List;

public record ConsumedAuthorizationCode(String codeId, String clientId, String userId, List<String> scopes) {
}
