package com.techStack.geoAccess.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Geographic access control settings.
 *
 * Bound from the {@code geo-security} prefix. Defaults here are the production defaults;
 * only {@code geo-security.audit.secret} has no usable default.
 */
@Data
@Component
@ConfigurationProperties(prefix = "geo-security")
public class GeoSecurityProperties {

    /** Deny with GEO_UNAVAILABLE when the lookup fails. {@code false} admits instead. */
    private boolean failClosed = true;

    /** Path prefixes that never reach the access filter. */
    private List<String> exemptPaths = new ArrayList<>(List.of(
            "/static/", "/media/", "/health/", "/favicon.ico", "/actuator/health"));

    private Lookup lookup = new Lookup();
    private Escalation escalation = new Escalation();
    private Exceptions exceptions = new Exceptions();
    private Policy policy = new Policy();
    private Audit audit = new Audit();
    private Notifications notifications = new Notifications();

    @Data
    public static class Lookup {
        private String url = "http://ip-api.com/json";
        private Duration timeout = Duration.ofSeconds(2);
        private Duration cacheTtl = Duration.ofHours(1);
        private long cacheMaxSize = 10_000;
        /** Country assigned to loopback and private addresses. Empty means they are unresolvable. */
        private String localAddressCountry;
    }

    @Data
    public static class Escalation {
        private int threshold = 3;
        private Duration window = Duration.ofHours(24);
        private int countryHopThreshold = 3;
        private Duration countryHopWindow = Duration.ofHours(1);
        /** How long an undelivered escalation keeps its attempts claimed. */
        private Duration claimTimeout = Duration.ofMinutes(5);
    }

    @Data
    public static class Exceptions {
        private Duration defaultDuration = Duration.ofDays(7);
        private Duration expirySweepInterval = Duration.ofMinutes(15);
    }

    @Data
    public static class Policy {
        private String defaultPrimaryCountry = "US";
        private Duration refreshInterval = Duration.ofSeconds(30);
    }

    @Data
    public static class Audit {
        /** Base64 HMAC key. Never logged or serialised. */
        private String secret;
        private String integritySweepCron = "0 0 * * * *";
    }

    @Data
    public static class Notifications {
        private String from = "security-noreply@localhost";
        private Duration sendTimeout = Duration.ofSeconds(10);
    }
}
