package io.factorialsystems.oauthserver.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@Validated
@Component
@ConfigurationProperties(prefix = "oauth.server")
public class OAuthServerProperties {

    /**
     * Issuer identifier; also the base for registration_client_uri.
     */
    @NotBlank
    private String issuer = "http://localhost:9000";

    private List<String> allowedOrigins = new ArrayList<>();

    private Duration authorizationCodeTimeToLive = Duration.ofMinutes(5);
    private Duration accessTokenTimeToLive = Duration.ofHours(1);
    private Duration refreshTokenTimeToLive = Duration.ofDays(30);

    private Registration registration = new Registration();
    private Cleanup cleanup = new Cleanup();
    private Audit audit = new Audit();

    @AssertTrue(message = "authorization-code-time-to-live must be between 1 second and 10 minutes")
    public boolean isAuthorizationCodeTimeToLiveValid() {
        return authorizationCodeTimeToLive != null
                && !authorizationCodeTimeToLive.isNegative()
                && !authorizationCodeTimeToLive.isZero()
                && authorizationCodeTimeToLive.compareTo(Duration.ofMinutes(10)) <= 0;
    }

    @Getter
    @Setter
    public static class Registration {
        // Permission the registering user must hold
        private String permission = "oauth:client:register";
        private List<String> allowedScopes = new ArrayList<>(List.of("read", "write"));
        private List<String> defaultScopes = new ArrayList<>(List.of("read"));
    }

    @Getter
    @Setter
    public static class Cleanup {
        private boolean enabled = true;
        private Duration interval = Duration.ofMinutes(15);
        private Duration retention = Duration.ofHours(1);
    }

    @Getter
    @Setter
    public static class Audit {
        private String exchange = "topic-exchange";
        private String auditRoutingKey = "oauth.audit.event";
        private String securityRoutingKey = "oauth.security.event";
        private String auditQueue = "oauth-audit-queue";
        private String securityQueue = "oauth-security-queue";
        private int publisherThreads = 2;
        private int maxPublisherThreads = 5;
        // Events beyond this backlog are dropped with a warning
        private int queueCapacity = 500;
    }
}
