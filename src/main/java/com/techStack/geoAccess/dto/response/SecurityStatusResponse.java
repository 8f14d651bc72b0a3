package com.techStack.geoAccess.dto.response;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class SecurityStatusResponse {
    boolean enforcementEnabled;
    boolean setupCompleted;
    String departmentName;
    /** Allowed country code to display name. */
    Map<String, String> allowedCountries;
    long knownIpCount;
    long distinctCountryCount;
    long blockedAttemptsLast30Days;
    long pendingExceptions;
    long unresolvedAttempts;
    Instant generatedAt;
}
