package com.techStack.geoAccess.dto.internal;

import com.techStack.geoAccess.models.audit.ChangeType;
import lombok.Builder;
import lombok.Value;

/**
 * Fields of an audit entry before it is stamped and sealed.
 */
@Value
@Builder
public class AuditEntryDraft {
    ChangeType changeType;
    String oldValue;
    String newValue;
    String justification;
    String actor;
    String requestIp;
    String userAgent;
}
