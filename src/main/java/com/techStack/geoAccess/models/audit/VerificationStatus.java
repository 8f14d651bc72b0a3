package com.techStack.geoAccess.models.audit;

public enum VerificationStatus {
    VALID,
    INTEGRITY_FAILURE,
    NOT_FOUND
}
