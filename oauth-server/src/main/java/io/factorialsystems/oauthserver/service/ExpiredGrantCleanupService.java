package io.factorialsystems.oauthserver.service;

import io.factorialsystems.oauthserver.config.OAuthServerProperties;
import io.factorialsystems.oauthserver.repository.AuthorizationCodeRepository;
import io.factorialsystems.oauthserver.repository.TokenRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Deletes codes and tokens that expired more than the configured retention ago. Rows that are
 * still inside the retention window are kept so replay detection keeps working for them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExpiredGrantCleanupService {

    private final AuthorizationCodeRepository authorizationCodeRepository;
    private final TokenRepository tokenRepository;
    private final OAuthServerProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${oauth.server.cleanup.interval:PT15M}",
            initialDelayString = "${oauth.server.cleanup.interval:PT15M}")
    public void scheduledCleanup() {
        if (!properties.getCleanup().isEnabled()) {
            return;
        }
        try {
            cleanupExpiredGrants();
        } catch (Exception e) {
            // Next run retries; the sweep is idempotent
            log.error("Expired grant cleanup failed", e);
        }
    }

    /**
     * Deletes expired rows that are already consumed or revoked, then retires the expired rows
     * that were never used so the next run can delete them.
     *
     * @return the number of deleted rows
     */
    public int cleanupExpiredGrants() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime cutoff = now.minus(properties.getCleanup().getRetention());

        int codes = authorizationCodeRepository.deleteExpired(cutoff);
        int tokens = tokenRepository.deleteExpired(cutoff);

        int retiredCodes = authorizationCodeRepository.retireExpired(now);
        int retiredTokens = tokenRepository.retireExpired(now);

        if (codes > 0 || tokens > 0) {
            log.info("Cleaned up {} expired authorization codes and {} expired tokens (cutoff {})", codes, tokens, cutoff);
        } else {
            log.debug("No expired grants older than {}", cutoff);
        }
        if (retiredCodes > 0 || retiredTokens > 0) {
            log.debug("Retired {} unused authorization codes and {} unrevoked tokens", retiredCodes, retiredTokens);
        }
        return codes + tokens;
    }
}
