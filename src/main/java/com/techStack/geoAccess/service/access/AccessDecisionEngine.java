package com.techStack.geoAccess.service.access;

import com.techStack.geoAccess.config.GeoSecurityProperties;
import com.techStack.geoAccess.constants.GeoSecurityConstants;
import com.techStack.geoAccess.dto.internal.AccessDecision;
import com.techStack.geoAccess.dto.internal.DecisionReason;
import com.techStack.geoAccess.dto.internal.RequestContext;
import com.techStack.geoAccess.exception.state.ExceptionNotActiveException;
import com.techStack.geoAccess.models.attempt.AttemptType;
import com.techStack.geoAccess.models.attempt.SuspiciousAccessAttempt;
import com.techStack.geoAccess.models.geo.GeoRecord;
import com.techStack.geoAccess.models.policy.SecurityPolicy;
import com.techStack.geoAccess.repository.SuspiciousAttemptRepository;
import com.techStack.geoAccess.repository.metrics.MetricsService;
import com.techStack.geoAccess.service.geo.GeoResolverService;
import com.techStack.geoAccess.service.policy.PolicyStore;
import com.techStack.geoAccess.service.security.SuspiciousActivityDetector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Access Decision Engine
 *
 * One verdict per authenticated request, evaluated in this order:
 * 1. policy unreadable → deny POLICY_UNAVAILABLE
 * 2. enforcement off → allow ENFORCEMENT_OFF (no lookup)
 * 3. lookup failed → GEO_UNAVAILABLE, denied unless fail-open is configured
 * 4. country on the allow-list → allow COUNTRY_ALLOWED
 * 5. active exception for user and country → allow EXCEPTION_ACTIVE, usage recorded
 * 6. otherwise → deny COUNTRY_BLOCKED, attempt recorded, escalation evaluated asynchronously
 *
 * Never emits an error: every failure maps to a verdict.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccessDecisionEngine {

    private static final Logger securityLog = LoggerFactory.getLogger(GeoSecurityConstants.SECURITY_AUDIT_LOGGER);

    private final PolicyStore policyStore;
    private final GeoResolverService geoResolver;
    private final ExceptionManager exceptionManager;
    private final SuspiciousAttemptRepository attemptRepository;
    private final SuspiciousActivityDetector detector;
    private final MetricsService metricsService;
    private final GeoSecurityProperties properties;
    private final Clock clock;

    public Mono<AccessDecision> authorize(String ipAddress, String userId, RequestContext context) {
        return policyStore.get()
                .flatMap(policy -> decide(policy, ipAddress, userId, context))
                .onErrorResume(e -> {
                    log.error("❌ Security policy unavailable, denying request from {}: {}", ipAddress, e.getMessage());
                    return Mono.just(AccessDecision.deny(DecisionReason.POLICY_UNAVAILABLE, null));
                })
                .doOnNext(decision -> metricsService.incrementCounter("geo.access.decisions",
                        "reason", decision.getReason().name(),
                        "allowed", String.valueOf(decision.isAllowed())));
    }

    private Mono<AccessDecision> decide(SecurityPolicy policy, String ipAddress, String userId, RequestContext context) {
        if (!policy.isEnforcementEnabled()) {
            return Mono.just(AccessDecision.allow(DecisionReason.ENFORCEMENT_OFF, null));
        }

        return geoResolver.resolve(ipAddress)
                .map(geo -> new Resolution(geo, null))
                .onErrorResume(e -> Mono.just(new Resolution(null, e)))
                .flatMap(resolution -> {
                    if (resolution.geo() == null) {
                        return Mono.just(unavailable(ipAddress, userId, resolution.error()));
                    }
                    GeoRecord geo = resolution.geo();
                    if (policy.isCountryAllowed(geo.getCountryCode())) {
                        return Mono.just(AccessDecision.allow(DecisionReason.COUNTRY_ALLOWED, geo));
                    }
                    return viaException(geo, userId)
                            .switchIfEmpty(Mono.defer(() -> block(geo, ipAddress, userId, context)));
                });
    }

    private AccessDecision unavailable(String ipAddress, String userId, Throwable error) {
        boolean failClosed = properties.isFailClosed();
        log.warn("Geolocation unavailable for {} (user {}), {}: {}",
                ipAddress, userId, failClosed ? "denying" : "admitting", error != null ? error.getMessage() : "no result");
        return failClosed
                ? AccessDecision.deny(DecisionReason.GEO_UNAVAILABLE, null)
                : AccessDecision.allow(DecisionReason.GEO_UNAVAILABLE, null);
    }

    private Mono<AccessDecision> viaException(GeoRecord geo, String userId) {
        if (userId == null) {
            return Mono.empty();
        }
        return exceptionManager.findActive(userId, geo.getCountryCode())
                .flatMap(exception -> exceptionManager.recordUsage(exception.getId()))
                .map(used -> AccessDecision.builder()
                        .allowed(true)
                        .reason(DecisionReason.EXCEPTION_ACTIVE)
                        .geo(geo)
                        .exceptionId(used.getId())
                        .build())
                .onErrorResume(ExceptionNotActiveException.class, e -> {
                    log.info("Exception for user {} in {} lapsed during use: {}", userId, geo.getCountryCode(), e.getMessage());
                    return Mono.empty();
                })
                .onErrorResume(e -> {
                    log.warn("Exception lookup for user {} in {} failed, treating as none: {}",
                            userId, geo.getCountryCode(), e.getMessage());
                    return Mono.empty();
                });
    }

    private Mono<AccessDecision> block(GeoRecord geo, String ipAddress, String userId, RequestContext context) {
        Instant now = clock.instant();
        AttemptType type = geo.isSuspicious() ? AttemptType.PROXY_DETECTED : AttemptType.BLOCKED_COUNTRY;

        SuspiciousAccessAttempt attempt = SuspiciousAccessAttempt.builder()
                .id(UUID.randomUUID().toString())
                .timestamp(now)
                .userId(userId)
                .ipAddress(geo.getIpAddress() != null ? geo.getIpAddress() : ipAddress)
                .countryCode(geo.getCountryCode())
                .countryName(geo.getCountryName())
                .city(geo.getCity())
                .threatLevel(geo.getThreatLevel())
                .attemptType(type)
                .wasBlocked(true)
                .userAgent(context.getUserAgent())
                .requestPath(context.getPath())
                .details(String.format("Access from %s (%s) is outside the allowed countries; isp=%s proxy=%s vpn=%s tor=%s",
                        geo.getCountryCode(), geo.getCity(), geo.getIsp(), geo.isProxy(), geo.isVpn(), geo.isTor()))
                .build();

        securityLog.warn("Blocked {} access by user {} from {} ({}, {}) to {}",
                type, userId, attempt.getIpAddress(), geo.getCountryCode(), geo.getCity(), context.getPath());

        return attemptRepository.save(attempt)
                .map(saved -> {
                    detector.evaluateAsync(saved);
                    return AccessDecision.builder()
                            .allowed(false)
                            .reason(DecisionReason.COUNTRY_BLOCKED)
                            .geo(geo)
                            .attemptId(saved.getId())
                            .build();
                })
                .onErrorResume(e -> {
                    log.error("❌ Blocked attempt by user {} from {} could not be recorded: {}",
                            userId, attempt.getIpAddress(), e.getMessage());
                    return Mono.just(AccessDecision.deny(DecisionReason.COUNTRY_BLOCKED, geo));
                });
    }

    private record Resolution(GeoRecord geo, Throwable error) {
    }
}
