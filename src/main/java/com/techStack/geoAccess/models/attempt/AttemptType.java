package com.techStack.geoAccess.models.attempt;

public enum AttemptType {
    BLOCKED_COUNTRY,
    PROXY_DETECTED,
    REPEATED_ATTEMPTS,
    RAPID_COUNTRY_CHANGE
}
