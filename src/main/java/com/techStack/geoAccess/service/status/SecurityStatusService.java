package com.techStack.geoAccess.service.status;

import com.techStack.geoAccess.constants.GeoSecurityConstants;
import com.techStack.geoAccess.dto.response.SecurityStatusResponse;
import com.techStack.geoAccess.models.access.ExceptionStatus;
import com.techStack.geoAccess.models.policy.SecurityPolicy;
import com.techStack.geoAccess.repository.AccessExceptionRepository;
import com.techStack.geoAccess.repository.GeoRecordRepository;
import com.techStack.geoAccess.repository.SuspiciousAttemptRepository;
import com.techStack.geoAccess.service.policy.PolicyStore;
import com.techStack.geoAccess.util.validation.CountryCodes;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dashboard summary for administrators.
 */
@Service
@RequiredArgsConstructor
public class SecurityStatusService {

    private final PolicyStore policyStore;
    private final GeoRecordRepository geoRecordRepository;
    private final SuspiciousAttemptRepository attemptRepository;
    private final AccessExceptionRepository exceptionRepository;
    private final Clock clock;

    public Mono<SecurityStatusResponse> status() {
        Instant now = clock.instant();
        Instant since = now.minus(Duration.ofDays(GeoSecurityConstants.STATUS_WINDOW_DAYS));

        return policyStore.get().flatMap(policy -> Mono.zip(
                        geoRecordRepository.count(),
                        geoRecordRepository.countDistinctCountries(),
                        attemptRepository.countBlockedSince(since),
                        exceptionRepository.countByStatus(ExceptionStatus.PENDING),
                        attemptRepository.countUnresolved())
                .map(counts -> SecurityStatusResponse.builder()
                        .enforcementEnabled(policy.isEnforcementEnabled())
                        .setupCompleted(policy.isSetupCompleted())
                        .departmentName(policy.getDepartmentName())
                        .allowedCountries(displayNames(policy))
                        .knownIpCount(counts.getT1())
                        .distinctCountryCount(counts.getT2())
                        .blockedAttemptsLast30Days(counts.getT3())
                        .pendingExceptions(counts.getT4())
                        .unresolvedAttempts(counts.getT5())
                        .generatedAt(now)
                        .build()));
    }

    private static Map<String, String> displayNames(SecurityPolicy policy) {
        Map<String, String> names = new LinkedHashMap<>();
        policy.getAllowedCountries().forEach(code -> names.put(code, CountryCodes.displayName(code)));
        return names;
    }
}
