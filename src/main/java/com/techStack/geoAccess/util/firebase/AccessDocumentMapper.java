package com.techStack.geoAccess.util.firebase;

import com.techStack.geoAccess.models.access.AccessException;
import com.techStack.geoAccess.models.access.ExceptionStatus;
import com.techStack.geoAccess.models.attempt.AttemptType;
import com.techStack.geoAccess.models.attempt.SuspiciousAccessAttempt;
import com.techStack.geoAccess.models.geo.ThreatLevel;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Map;

import static com.techStack.geoAccess.util.firebase.FirestoreFields.*;

/**
 * Mapping for exceptions and suspicious attempts.
 */
public final class AccessDocumentMapper {

    private AccessDocumentMapper() {}

    public static Map<String, Object> toMap(AccessException exception) {
        Map<String, Object> data = new HashMap<>();
        data.put("id", exception.getId());
        data.put("userId", exception.getUserId());
        data.put("destinationCountry", exception.getDestinationCountry());
        data.put("reason", exception.getReason());
        putTimestamp(data, "startsAt", exception.getStartsAt());
        putTimestamp(data, "endsAt", exception.getEndsAt());
        data.put("status", enumName(exception.getStatus()));
        data.put("requestedBy", exception.getRequestedBy());
        putTimestamp(data, "requestedAt", exception.getRequestedAt());
        data.put("contactEmail", exception.getContactEmail());
        data.put("sourceAttemptId", exception.getSourceAttemptId());
        data.put("decidedBy", exception.getDecidedBy());
        putTimestamp(data, "decidedAt", exception.getDecidedAt());
        data.put("adminNotes", exception.getAdminNotes());
        data.put("revokedBy", exception.getRevokedBy());
        putTimestamp(data, "revokedAt", exception.getRevokedAt());
        data.put("timesUsed", exception.getTimesUsed());
        putTimestamp(data, "lastUsed", exception.getLastUsed());
        return data;
    }

    public static AccessException exceptionFromMap(Map<String, Object> data) {
        if (data == null || data.isEmpty()) {
            return null;
        }
        return AccessException.builder()
                .id(getString(data, "id"))
                .userId(getString(data, "userId"))
                .destinationCountry(getString(data, "destinationCountry"))
                .reason(getString(data, "reason"))
                .startsAt(getInstant(data, "startsAt"))
                .endsAt(getInstant(data, "endsAt"))
                .status(getEnum(data, "status", ExceptionStatus.class))
                .requestedBy(getString(data, "requestedBy"))
                .requestedAt(getInstant(data, "requestedAt"))
                .contactEmail(getString(data, "contactEmail"))
                .sourceAttemptId(getString(data, "sourceAttemptId"))
                .decidedBy(getString(data, "decidedBy"))
                .decidedAt(getInstant(data, "decidedAt"))
                .adminNotes(getString(data, "adminNotes"))
                .revokedBy(getString(data, "revokedBy"))
                .revokedAt(getInstant(data, "revokedAt"))
                .timesUsed(getLong(data, "timesUsed"))
                .lastUsed(getInstant(data, "lastUsed"))
                .build();
    }

    public static Map<String, Object> toMap(SuspiciousAccessAttempt attempt) {
        Map<String, Object> data = new HashMap<>();
        data.put("id", attempt.getId());
        putTimestamp(data, "timestamp", attempt.getTimestamp());
        data.put("userId", attempt.getUserId());
        data.put("ipAddress", attempt.getIpAddress());
        data.put("countryCode", attempt.getCountryCode());
        data.put("countryName", attempt.getCountryName());
        data.put("city", attempt.getCity());
        data.put("threatLevel", enumName(attempt.getThreatLevel()));
        data.put("attemptType", enumName(attempt.getAttemptType()));
        data.put("wasBlocked", attempt.isWasBlocked());
        data.put("userAgent", attempt.getUserAgent());
        data.put("requestPath", attempt.getRequestPath());
        data.put("details", attempt.getDetails());
        data.put("itNotified", attempt.isItNotified());
        putTimestamp(data, "itNotifiedAt", attempt.getItNotifiedAt());
        data.put("escalationReasons", attempt.getEscalationReasons() != null
                ? new ArrayList<>(attempt.getEscalationReasons()) : new ArrayList<>());
        data.put("resolved", attempt.isResolved());
        data.put("resolvedBy", attempt.getResolvedBy());
        putTimestamp(data, "resolvedAt", attempt.getResolvedAt());
        data.put("resolutionNotes", attempt.getResolutionNotes());
        return data;
    }

    public static SuspiciousAccessAttempt attemptFromMap(Map<String, Object> data) {
        if (data == null || data.isEmpty()) {
            return null;
        }
        return SuspiciousAccessAttempt.builder()
                .id(getString(data, "id"))
                .timestamp(getInstant(data, "timestamp"))
                .userId(getString(data, "userId"))
                .ipAddress(getString(data, "ipAddress"))
                .countryCode(getString(data, "countryCode"))
                .countryName(getString(data, "countryName"))
                .city(getString(data, "city"))
                .threatLevel(getEnum(data, "threatLevel", ThreatLevel.class))
                .attemptType(getEnum(data, "attemptType", AttemptType.class))
                .wasBlocked(getBoolean(data, "wasBlocked"))
                .userAgent(getString(data, "userAgent"))
                .requestPath(getString(data, "requestPath"))
                .details(getString(data, "details"))
                .itNotified(getBoolean(data, "itNotified"))
                .itNotifiedAt(getInstant(data, "itNotifiedAt"))
                .escalationReasons(new ArrayList<>(getStringList(data, "escalationReasons")))
                .resolved(getBoolean(data, "resolved"))
                .resolvedBy(getString(data, "resolvedBy"))
                .resolvedAt(getInstant(data, "resolvedAt"))
                .resolutionNotes(getString(data, "resolutionNotes"))
                .build();
    }
}
