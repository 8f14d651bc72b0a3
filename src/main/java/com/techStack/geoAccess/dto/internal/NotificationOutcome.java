package com.techStack.geoAccess.dto.internal;

import lombok.Value;

/**
 * Delivery result. Failures are data, not errors.
 */
@Value
public class NotificationOutcome {
    boolean delivered;
    int recipientCount;
    String error;

    public static NotificationOutcome delivered(int recipientCount) {
        return new NotificationOutcome(true, recipientCount, null);
    }

    public static NotificationOutcome failed(int recipientCount, String error) {
        return new NotificationOutcome(false, recipientCount, error);
    }
}
