package com.techStack.geoAccess.dto.internal;

import com.techStack.geoAccess.models.audit.VerificationStatus;
import lombok.Value;

import java.time.Instant;

@Value
public class VerificationResult {
    String entryId;
    VerificationStatus status;
    Instant checkedAt;
}
