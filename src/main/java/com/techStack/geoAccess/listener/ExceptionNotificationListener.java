package com.techStack.geoAccess.listener;

import com.techStack.geoAccess.event.ExceptionLifecycleEvent;
import com.techStack.geoAccess.service.notification.SecurityNotificationService;
import com.techStack.geoAccess.service.policy.PolicyStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Exception Lifecycle Listener
 *
 * Tells IT about new requests and decisions, and the requester about decisions.
 * Runs after the transition is committed; a failed notice never undoes it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExceptionNotificationListener {

    private static final Duration NOTIFY_TIMEOUT = Duration.ofSeconds(30);

    private final PolicyStore policyStore;
    private final SecurityNotificationService notificationService;

    @Async
    @EventListener
    public void handleExceptionEvent(ExceptionLifecycleEvent event) {
        String exceptionId = event.getException().getId();
        try {
            policyStore.get()
                    .flatMap(policy -> notificationService.notifyExceptionEvent(policy, event))
                    .doOnNext(outcome -> {
                        if (outcome.isDelivered()) {
                            log.info("📧 {} notice for exception {} sent to {} recipient(s)",
                                    event.getAction(), exceptionId, outcome.getRecipientCount());
                        } else {
                            log.warn("{} notice for exception {} not delivered: {}",
                                    event.getAction(), exceptionId, outcome.getError());
                        }
                    })
                    .block(NOTIFY_TIMEOUT);
        } catch (RuntimeException e) {
            log.error("❌ Failed to process {} event for exception {}: {}",
                    event.getAction(), exceptionId, e.getMessage(), e);
        }
    }
}
