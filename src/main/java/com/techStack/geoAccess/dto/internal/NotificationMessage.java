package com.techStack.geoAccess.dto.internal;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class NotificationMessage {
    @Singular
    List<String> recipients;
    String subject;
    String body;
    @Builder.Default
    NotificationPriority priority = NotificationPriority.NORMAL;
}
