package com.techStack.geoAccess.dto.internal;

import com.techStack.geoAccess.models.geo.GeoRecord;
import lombok.Builder;
import lombok.Value;

/**
 * Verdict for one request. {@code geo} is null when no lookup happened or it failed.
 */
@Value
@Builder
public class AccessDecision {
    boolean allowed;
    DecisionReason reason;
    GeoRecord geo;
    String exceptionId;
    String attemptId;

    public static AccessDecision allow(DecisionReason reason, GeoRecord geo) {
        return AccessDecision.builder().allowed(true).reason(reason).geo(geo).build();
    }

    public static AccessDecision deny(DecisionReason reason, GeoRecord geo) {
        return AccessDecision.builder().allowed(false).reason(reason).geo(geo).build();
    }
}
