package com.techStack.geoAccess.service.security;

import com.techStack.geoAccess.constants.GeoSecurityConstants;
import com.techStack.geoAccess.models.attempt.SuspiciousAccessAttempt;
import com.techStack.geoAccess.repository.SuspiciousAttemptRepository;
import com.techStack.geoAccess.util.validation.HelperUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;

/**
 * Reviewer view of blocked attempts. Attempts are never deleted; only the resolution fields
 * are written here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AttemptReviewService {

    private static final Logger securityLog = LoggerFactory.getLogger(GeoSecurityConstants.SECURITY_AUDIT_LOGGER);

    private final SuspiciousAttemptRepository attemptRepository;
    private final Clock clock;

    public Flux<SuspiciousAccessAttempt> list(boolean unresolvedOnly, int limit) {
        return attemptRepository.findRecent(unresolvedOnly, HelperUtils.clampLimit(limit));
    }

    public Mono<SuspiciousAccessAttempt> resolve(String attemptId, String reviewer, String notes) {
        return attemptRepository.resolve(attemptId, reviewer, StringUtils.trimToNull(notes), clock.instant())
                .doOnNext(resolved -> securityLog.info("Attempt {} (user {}, {}) resolved by {}",
                        attemptId, resolved.getUserId(), resolved.getCountryCode(), reviewer));
    }
}
