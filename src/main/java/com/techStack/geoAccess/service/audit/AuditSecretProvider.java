package com.techStack.geoAccess.service.audit;

/**
 * Source of the key that seals audit entries. The key stays server side; it is never stored
 * with the entries it protects.
 */
public interface AuditSecretProvider {

    byte[] getSecret();
}
