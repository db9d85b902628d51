package com.shoptalk.session.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration properties for conversation sessions.
 * Maps to shoptalk.session.* properties in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "shoptalk.session")
public class SessionProperties {

    /** Inactivity window after which a session is discarded */
    private int timeoutMinutes = 30;

    /** Products remembered for ordinal references ("option 2") */
    private int maxShownProducts = 10;

    /** Messages kept per session, oldest dropped first */
    private int maxHistory = 50;

    /** Delay between expired-session sweeps in milliseconds */
    private long sweepIntervalMs = 60_000;

    private Redis redis = new Redis();

    @Data
    public static class Redis {
        /** Write sessions through to Redis so they survive restarts */
        private boolean enabled = false;
        /** Key prefix for stored sessions */
        private String keyPrefix = "shoptalk:session:";
    }

    public Duration timeout() {
        return Duration.ofMinutes(timeoutMinutes);
    }
}
