package com.techStack.geoAccess.models.access;

public enum ExceptionStatus {
    PENDING,
    APPROVED,
    DENIED,
    EXPIRED,
    REVOKED;

    public boolean isTerminal() {
        return this == DENIED || this == EXPIRED || this == REVOKED;
    }
}
