package com.techStack.geoAccess.service.audit;

import com.techStack.geoAccess.models.audit.AuditEntry;
import com.techStack.geoAccess.models.audit.ChangeType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class AuditChecksumCalculatorTest {

    private static final byte[] KEY = "0123456789abcdef0123456789abcdef".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] OTHER_KEY = "fedcba9876543210fedcba9876543210".getBytes(StandardCharsets.US_ASCII);

    private AuditChecksumCalculator calculator;
    private AuditEntry entry;

    @BeforeEach
    void setUp() {
        calculator = new AuditChecksumCalculator(() -> KEY);
        entry = AuditEntry.builder()
                .id("entry-1")
                .timestamp(Instant.parse("2024-03-01T10:15:30.123Z"))
                .actor("admin")
                .changeType(ChangeType.PRIMARY_COUNTRY)
                .oldValue("US")
                .newValue("CA")
                .justification("Office relocation")
                .requestIp("203.0.113.7")
                .userAgent("curl/8.0")
                .build();
    }

    @Test
    void compute_isDeterministic() {
        assertThat(calculator.compute(entry))
                .isEqualTo(calculator.compute(entry.toBuilder().build()))
                .hasSize(64)
                .matches("^[0-9a-f]+$");
    }

    @Test
    void compute_changesWhenAnySealedFieldChanges() {
        String original = calculator.compute(entry);

        assertThat(calculator.compute(entry.toBuilder().newValue("MX").build())).isNotEqualTo(original);
        assertThat(calculator.compute(entry.toBuilder().oldValue("GB").build())).isNotEqualTo(original);
        assertThat(calculator.compute(entry.toBuilder().actor("intruder").build())).isNotEqualTo(original);
        assertThat(calculator.compute(entry.toBuilder().changeType(ChangeType.SECONDARY_COUNTRY).build()))
                .isNotEqualTo(original);
        assertThat(calculator.compute(entry.toBuilder().timestamp(entry.getTimestamp().plusMillis(1)).build()))
                .isNotEqualTo(original);
        assertThat(calculator.compute(entry.toBuilder().justification(null).build())).isNotEqualTo(original);
    }

    @Test
    void compute_dependsOnSecret() {
        AuditChecksumCalculator otherKey = new AuditChecksumCalculator(() -> OTHER_KEY);

        assertThat(otherKey.compute(entry)).isNotEqualTo(calculator.compute(entry));
    }

    @Test
    void canonicalize_keepsFieldBoundaries() {
        AuditEntry joined = entry.toBuilder().oldValue("USCA").newValue(null).build();
        AuditEntry split = entry.toBuilder().oldValue("US").newValue("CA").build();
        AuditEntry emptyVersusNull = entry.toBuilder().oldValue("").build();
        AuditEntry nullOld = entry.toBuilder().oldValue(null).build();

        assertThat(AuditChecksumCalculator.canonicalize(joined))
                .isNotEqualTo(AuditChecksumCalculator.canonicalize(split));
        assertThat(AuditChecksumCalculator.canonicalize(emptyVersusNull))
                .isNotEqualTo(AuditChecksumCalculator.canonicalize(nullOld));
    }

    @Test
    void matches_acceptsSealedEntryAndRejectsTampering() {
        AuditEntry sealed = entry.toBuilder().checksum(calculator.compute(entry)).build();

        assertThat(calculator.matches(sealed)).isTrue();
        assertThat(calculator.matches(sealed.toBuilder().newValue("RU").build())).isFalse();
        assertThat(calculator.matches(sealed.toBuilder().checksum(null).build())).isFalse();
        assertThat(calculator.matches(sealed.toBuilder().checksum("deadbeef").build())).isFalse();
    }
}
