package com.techStack.geoAccess.repository.notification;

import com.techStack.geoAccess.dto.internal.NotificationMessage;
import com.techStack.geoAccess.dto.internal.NotificationOutcome;
import reactor.core.publisher.Mono;

/**
 * Outbound alert channel.
 *
 * Implementations never emit an error: delivery failure is reported as an undelivered
 * {@link NotificationOutcome}.
 */
public interface Notifier {

    Mono<NotificationOutcome> send(NotificationMessage message);
}
