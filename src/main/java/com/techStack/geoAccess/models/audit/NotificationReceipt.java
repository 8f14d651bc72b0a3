package com.techStack.geoAccess.models.audit;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Write-once outcome of the notification sent for an audit entry, keyed by the entry id.
 */
@Value
@Builder
public class NotificationReceipt {
    String entryId;
    boolean delivered;
    int recipientCount;
    String error;
    Instant recordedAt;
}
