package com.techStack.geoAccess.models.audit;

public enum ChangeType {
    POLICY_INITIALIZED,
    PRIMARY_COUNTRY,
    SECONDARY_COUNTRY,
    ENFORCEMENT_TOGGLE,
    DEPARTMENT_NAME,
    DEPARTMENT_ABBREVIATION,
    TIMEZONE,
    ADMIN_CONTACT,
    IT_CONTACT,
    SECURITY_CONTACT;

    public boolean isCountryChange() {
        return this == PRIMARY_COUNTRY || this == SECONDARY_COUNTRY;
    }

    /** Changes leadership is told about. */
    public boolean requiresLeadershipNotice() {
        return isCountryChange() || this == ENFORCEMENT_TOGGLE;
    }
}
