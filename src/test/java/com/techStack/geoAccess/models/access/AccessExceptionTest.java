package com.techStack.geoAccess.models.access;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class AccessExceptionTest {

    private static final Instant START = Instant.parse("2024-07-01T00:00:00Z");
    private static final Instant END = Instant.parse("2024-07-08T00:00:00Z");

    private AccessException withStatus(ExceptionStatus status) {
        return AccessException.builder()
                .id("exc-1")
                .userId("u1")
                .destinationCountry("RU")
                .startsAt(START)
                .endsAt(END)
                .status(status)
                .build();
    }

    @Test
    void isActiveAt_coversWindowInclusively() {
        AccessException approved = withStatus(ExceptionStatus.APPROVED);

        assertThat(approved.isActiveAt(START.minusSeconds(1))).isFalse();
        assertThat(approved.isActiveAt(START)).isTrue();
        assertThat(approved.isActiveAt(END)).isTrue();
        assertThat(approved.isActiveAt(END.plusSeconds(1))).isFalse();
    }

    @Test
    void isActiveAt_requiresApproval() {
        Instant inside = START.plusSeconds(3600);

        assertThat(withStatus(ExceptionStatus.PENDING).isActiveAt(inside)).isFalse();
        assertThat(withStatus(ExceptionStatus.DENIED).isActiveAt(inside)).isFalse();
        assertThat(withStatus(ExceptionStatus.REVOKED).isActiveAt(inside)).isFalse();
    }

    @Test
    void effectiveStatus_readsExpiredOncePastEnd() {
        AccessException approved = withStatus(ExceptionStatus.APPROVED);

        assertThat(approved.effectiveStatus(END)).isEqualTo(ExceptionStatus.APPROVED);
        assertThat(approved.effectiveStatus(END.plusSeconds(1))).isEqualTo(ExceptionStatus.EXPIRED);
        assertThat(approved.isStaleApproval(END.plusSeconds(1))).isTrue();
        assertThat(approved.withEffectiveStatus(END.plusSeconds(1)).getStatus()).isEqualTo(ExceptionStatus.EXPIRED);
        assertThat(approved.getStatus()).isEqualTo(ExceptionStatus.APPROVED);
    }

    @Test
    void effectiveStatus_leavesOtherStatusesAlone() {
        Instant after = END.plusSeconds(60);

        assertThat(withStatus(ExceptionStatus.PENDING).effectiveStatus(after)).isEqualTo(ExceptionStatus.PENDING);
        assertThat(withStatus(ExceptionStatus.REVOKED).effectiveStatus(after)).isEqualTo(ExceptionStatus.REVOKED);
        assertThat(withStatus(ExceptionStatus.REVOKED).isStaleApproval(after)).isFalse();
    }

    @Test
    void blocksNewRequestAt_onlyForOpenExceptions() {
        Instant inside = START.plusSeconds(60);
        Instant after = END.plusSeconds(60);

        assertThat(withStatus(ExceptionStatus.APPROVED).blocksNewRequestAt(inside)).isTrue();
        assertThat(withStatus(ExceptionStatus.APPROVED).blocksNewRequestAt(after)).isFalse();
        assertThat(withStatus(ExceptionStatus.PENDING).blocksNewRequestAt(inside)).isTrue();
        assertThat(withStatus(ExceptionStatus.PENDING).blocksNewRequestAt(after)).isFalse();
        assertThat(withStatus(ExceptionStatus.DENIED).blocksNewRequestAt(inside)).isFalse();
        assertThat(withStatus(ExceptionStatus.REVOKED).blocksNewRequestAt(inside)).isFalse();
    }
}
