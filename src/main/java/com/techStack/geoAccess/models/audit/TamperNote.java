package com.techStack.geoAccess.models.audit;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Record of a failed verification. Holds no checksum material.
 */
@Value
@Builder
public class TamperNote {
    String id;
    String entryId;
    Instant detectedAt;
    String detectedBy;
    String detail;
}
