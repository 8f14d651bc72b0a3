package com.techStack.geoAccess.constants;

public final class GeoSecurityConstants {

    private GeoSecurityConstants() {}

    // Collection names
    public static final String COLLECTION_GEO_RECORDS = "ip_geolocations";
    public static final String COLLECTION_SECURITY_POLICY = "security_policy";
    public static final String COLLECTION_AUDIT_LEDGER = "security_audit_ledger";
    public static final String COLLECTION_AUDIT_RECEIPTS = "security_audit_receipts";
    public static final String COLLECTION_TAMPER_NOTES = "security_tamper_notes";
    public static final String COLLECTION_ACCESS_EXCEPTIONS = "international_access_exceptions";
    public static final String COLLECTION_SUSPICIOUS_ATTEMPTS = "suspicious_access_attempts";

    // The singleton policy document
    public static final String ACTIVE_POLICY_DOC_ID = "active";

    // Redis
    public static final String GEO_LOOKUP_KEY_PREFIX = "geo:lookup:";

    // Request headers
    public static final String HEADER_FORWARDED_FOR = "X-Forwarded-For";
    public static final String UNKNOWN_IP = "unknown";

    // Query limits
    public static final int DEFAULT_LIST_LIMIT = 100;
    public static final int MAX_LIST_LIMIT = 500;

    // Status window for blocked-attempt statistics
    public static final int STATUS_WINDOW_DAYS = 30;

    // Logger for security-relevant events (routed separately in logback-spring.xml)
    public static final String SECURITY_AUDIT_LOGGER = "SECURITY_AUDIT";
}
