package com.techStack.geoAccess.dto.internal;

public enum DecisionReason {
    ENFORCEMENT_OFF,
    COUNTRY_ALLOWED,
    EXCEPTION_ACTIVE,
    COUNTRY_BLOCKED,
    GEO_UNAVAILABLE,
    POLICY_UNAVAILABLE
}
