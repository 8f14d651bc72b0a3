package com.techStack.geoAccess.dto.response;

import com.techStack.geoAccess.models.audit.AuditEntry;
import com.techStack.geoAccess.models.audit.ChangeType;
import com.techStack.geoAccess.models.audit.NotificationReceipt;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Read-only projection of a ledger entry joined with its notification receipt.
 */
@Value
@Builder
public class AuditEntryView {
    String id;
    Instant timestamp;
    String actor;
    ChangeType changeType;
    String oldValue;
    String newValue;
    String justification;
    String requestIp;
    String userAgent;
    String checksum;
    boolean notificationSent;
    int recipientCount;

    public static AuditEntryView of(AuditEntry entry, NotificationReceipt receipt) {
        return AuditEntryView.builder()
                .id(entry.getId())
                .timestamp(entry.getTimestamp())
                .actor(entry.getActor())
                .changeType(entry.getChangeType())
                .oldValue(entry.getOldValue())
                .newValue(entry.getNewValue())
                .justification(entry.getJustification())
                .requestIp(entry.getRequestIp())
                .userAgent(entry.getUserAgent())
                .checksum(entry.getChecksum())
                .notificationSent(receipt != null && receipt.isDelivered())
                .recipientCount(receipt != null ? receipt.getRecipientCount() : 0)
                .build();
    }
}
