package com.techStack.geoAccess.models.audit;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One sealed ledger record of a policy change. There is no mutator: the checksum covers every
 * other field, so a modified copy no longer verifies.
 */
@Value
@Builder(toBuilder = true)
public class AuditEntry {
    String id;
    Instant timestamp;
    String actor;
    ChangeType changeType;
    String oldValue;
    String newValue;
    String justification;
    String requestIp;
    String userAgent;
    String checksum;
}
