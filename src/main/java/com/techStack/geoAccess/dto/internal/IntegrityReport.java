package com.techStack.geoAccess.dto.internal;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class IntegrityReport {
    long validCount;
    long invalidCount;
    List<String> invalidEntryIds;
    Instant checkedAt;

    public long getTotalCount() {
        return validCount + invalidCount;
    }

    public boolean isIntact() {
        return invalidCount == 0;
    }
}
