package com.techStack.geoAccess.dto.internal;

public enum EscalationReason {
    REPEATED_ATTEMPTS,
    ANONYMIZER_DETECTED,
    RAPID_COUNTRY_CHANGE
}
