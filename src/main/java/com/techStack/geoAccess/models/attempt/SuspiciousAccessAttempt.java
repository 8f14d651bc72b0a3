package com.techStack.geoAccess.models.attempt;

import com.techStack.geoAccess.models.geo.ThreatLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A denied or flagged request. Kept for forensics; only the notification and resolution
 * fields change after creation.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SuspiciousAccessAttempt {

    private String id;
    private Instant timestamp;
    private String userId;

    private String ipAddress;
    private String countryCode;
    private String countryName;
    private String city;
    private ThreatLevel threatLevel;

    private AttemptType attemptType;
    private boolean wasBlocked;
    private String userAgent;
    private String requestPath;
    private String details;

    private boolean itNotified;
    private Instant itNotifiedAt;
    @Builder.Default
    private List<String> escalationReasons = new ArrayList<>();

    private boolean resolved;
    private String resolvedBy;
    private Instant resolvedAt;
    private String resolutionNotes;

    public boolean isAnonymized() {
        return attemptType == AttemptType.PROXY_DETECTED;
    }
}
