package com.techStack.geoAccess.service.audit;

import com.techStack.geoAccess.models.audit.AuditEntry;
import org.apache.commons.codec.digest.HmacAlgorithms;
import org.apache.commons.codec.digest.HmacUtils;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Instant;

/**
 * Keyed checksum of an audit entry.
 *
 * <p>The checksum is HMAC-SHA256 over a canonical form of every field except the checksum. Each
 * field is written as {@code <length>:<value>} ({@code -1:} for null), so no two different
 * entries share a canonical form.
 */
@Component
public class AuditChecksumCalculator {

    private final AuditSecretProvider secretProvider;

    public AuditChecksumCalculator(AuditSecretProvider secretProvider) {
        this.secretProvider = secretProvider;
    }

    public String compute(AuditEntry entry) {
        return new HmacUtils(HmacAlgorithms.HMAC_SHA_256, secretProvider.getSecret())
                .hmacHex(canonicalize(entry));
    }

    /**
     * Constant-time comparison of the stored checksum with a fresh one.
     */
    public boolean matches(AuditEntry entry) {
        if (entry.getChecksum() == null) {
            return false;
        }
        byte[] expected = compute(entry).getBytes(StandardCharsets.US_ASCII);
        byte[] actual = entry.getChecksum().getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, actual);
    }

    static String canonicalize(AuditEntry entry) {
        StringBuilder canonical = new StringBuilder(256);
        append(canonical, entry.getId());
        append(canonical, epochMillis(entry.getTimestamp()));
        append(canonical, entry.getActor());
        append(canonical, entry.getChangeType() != null ? entry.getChangeType().name() : null);
        append(canonical, entry.getOldValue());
        append(canonical, entry.getNewValue());
        append(canonical, entry.getJustification());
        append(canonical, entry.getRequestIp());
        append(canonical, entry.getUserAgent());
        return canonical.toString();
    }

    private static void append(StringBuilder canonical, String value) {
        if (value == null) {
            canonical.append("-1:");
        } else {
            canonical.append(value.length()).append(':').append(value);
        }
        canonical.append('|');
    }

    private static String epochMillis(Instant timestamp) {
        return timestamp != null ? Long.toString(timestamp.toEpochMilli()) : null;
    }
}
