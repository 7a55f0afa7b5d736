package io.factorialsystems.oauthserver.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * General application configuration
 */
@Configuration
public class ApplicationConfig {

    /**
     * Every expiry decision reads the time from this clock.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
