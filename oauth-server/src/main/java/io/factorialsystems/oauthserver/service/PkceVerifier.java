package io.factorialsystems.oauthserver.service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.regex.Pattern;

/**
 * RFC 7636 checks. Only the S256 method is accepted.
 */
public final class PkceVerifier {

    public static final String S256 = "S256";

    // 43-128 characters from the unreserved set
    private static final Pattern VERIFIER_PATTERN = Pattern.compile("^[A-Za-z0-9\\-._~]{43,128}$");
    // BASE64URL(SHA-256) without padding is always 43 characters
    private static final Pattern CHALLENGE_PATTERN = Pattern.compile("^[A-Za-z0-9\\-_]{43}$");

    private PkceVerifier() {
    }

    public static boolean isSupportedMethod(String method) {
        return S256.equals(method);
    }

    public static boolean isWellFormedChallenge(String codeChallenge) {
        return codeChallenge != null && CHALLENGE_PATTERN.matcher(codeChallenge).matches();
    }

    public static String computeChallenge(String codeVerifier) {
        byte[] digest = SecureTokenGenerator.sha256(codeVerifier.getBytes(StandardCharsets.US_ASCII));
        return Base64.getUrlEncoder().withoutPadding().encodeToString(digest);
    }

    /**
     * Constant-time comparison of BASE64URL(SHA-256(verifier)) against the stored challenge.
     */
    public static boolean matches(String codeVerifier, String codeChallenge, String method) {
        if (codeVerifier == null || codeChallenge == null || !isSupportedMethod(method)) {
            return false;
        }
        if (!VERIFIER_PATTERN.matcher(codeVerifier).matches()) {
            return false;
        }
        byte[] computed = computeChallenge(codeVerifier).getBytes(StandardCharsets.US_ASCII);
        byte[] expected = codeChallenge.getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(computed, expected);
    }
}
