package com.techStack.geoAccess.dto.internal;

import com.techStack.geoAccess.models.audit.AuditEntry;
import com.techStack.geoAccess.models.policy.SecurityPolicy;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A committed policy change. {@code warnings} carries conditions the caller should see
 * (e.g. leadership could not be notified) that did not undo the change.
 */
@Value
@Builder
public class PolicyUpdateResult {
    SecurityPolicy policy;
    @Singular
    List<AuditEntry> entries;
    @Singular
    List<String> warnings;
    boolean changed;
}
