package com.techStack.geoAccess.models.access;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Time-boxed permission for one user to work from one otherwise blocked country.
 *
 * <p>Expiry is derived: a stored APPROVED exception whose window has ended reads as EXPIRED.
 * The stored status is only rewritten to EXPIRED by the next write that notices it.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AccessException {

    private String id;
    private String userId;
    private String destinationCountry;
    private String reason;
    private Instant startsAt;
    private Instant endsAt;
    private ExceptionStatus status;

    private String requestedBy;
    private Instant requestedAt;
    private String contactEmail;
    private String sourceAttemptId;

    private String decidedBy;
    private Instant decidedAt;
    private String adminNotes;

    private String revokedBy;
    private Instant revokedAt;

    private long timesUsed;
    private Instant lastUsed;

    public ExceptionStatus effectiveStatus(Instant now) {
        if (status == ExceptionStatus.APPROVED && endsAt != null && now.isAfter(endsAt)) {
            return ExceptionStatus.EXPIRED;
        }
        return status;
    }

    /** Approved, unexpired and already started. */
    public boolean isActiveAt(Instant now) {
        return effectiveStatus(now) == ExceptionStatus.APPROVED
                && startsAt != null && !now.isBefore(startsAt)
                && endsAt != null && !now.isAfter(endsAt);
    }

    /** True while this exception prevents another request for the same user and destination. */
    public boolean blocksNewRequestAt(Instant now) {
        ExceptionStatus effective = effectiveStatus(now);
        if (effective == ExceptionStatus.APPROVED) {
            return true;
        }
        return effective == ExceptionStatus.PENDING && endsAt != null && now.isBefore(endsAt);
    }

    /** Stored APPROVED but past its window. */
    public boolean isStaleApproval(Instant now) {
        return status == ExceptionStatus.APPROVED && effectiveStatus(now) == ExceptionStatus.EXPIRED;
    }

    /** Copy carrying the derived status, for presentation. */
    public AccessException withEffectiveStatus(Instant now) {
        return toBuilder().status(effectiveStatus(now)).build();
    }
}
