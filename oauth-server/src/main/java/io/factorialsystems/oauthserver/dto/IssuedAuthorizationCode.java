package io.factorialsystems.oauthserver.dto;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * A freshly minted authorization code. {@code code} is the raw value; only its hash is persisted.
 */
public record IssuedAuthorizationCode(String code, String codeId, String redirectUri, List<String> scopes,
                                      OffsetDateTime expiresAt) {
}
