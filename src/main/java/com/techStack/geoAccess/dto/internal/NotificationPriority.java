package com.techStack.geoAccess.dto.internal;

public enum NotificationPriority {
    LOW,
    NORMAL,
    HIGH,
    CRITICAL
}
