package com.techStack.geoAccess.service.audit;

import com.techStack.geoAccess.config.GeoSecurityProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.Base64;

/**
 * Reads the audit key from {@code geo-security.audit.secret}, normally injected from the
 * environment or a secret store. Startup fails when it is missing or too short.
 */
@Slf4j
@Component
public class PropertyAuditSecretProvider implements AuditSecretProvider {

    static final int MIN_KEY_BYTES = 32;

    private final byte[] secret;

    public PropertyAuditSecretProvider(GeoSecurityProperties properties) {
        String encoded = properties.getAudit().getSecret();
        if (StringUtils.isBlank(encoded)) {
            throw new IllegalStateException("geo-security.audit.secret must be configured");
        }

        byte[] decoded;
        try {
            decoded = Base64.getDecoder().decode(encoded.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("geo-security.audit.secret is not valid base64", e);
        }

        if (decoded.length < MIN_KEY_BYTES) {
            throw new IllegalStateException(
                    "geo-security.audit.secret must decode to at least " + MIN_KEY_BYTES + " bytes");
        }

        this.secret = decoded;
        log.info("Audit ledger key loaded ({} bytes)", decoded.length);
    }

    @Override
    public byte[] getSecret() {
        return secret.clone();
    }
}
