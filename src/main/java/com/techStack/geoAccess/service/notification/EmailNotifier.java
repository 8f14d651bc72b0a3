package com.techStack.geoAccess.service.notification;

import com.techStack.geoAccess.config.GeoSecurityProperties;
import com.techStack.geoAccess.dto.internal.NotificationMessage;
import com.techStack.geoAccess.dto.internal.NotificationOutcome;
import com.techStack.geoAccess.dto.internal.NotificationPriority;
import com.techStack.geoAccess.repository.metrics.MetricsService;
import com.techStack.geoAccess.repository.notification.Notifier;
import com.techStack.geoAccess.util.validation.HelperUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.List;
import java.util.stream.Collectors;

@Service
public class EmailNotifier implements Notifier {
    private static final Logger logger = LoggerFactory.getLogger(EmailNotifier.class);

    private final JavaMailSender mailSender;
    private final Scheduler emailScheduler;
    private final MetricsService metricsService;
    private final GeoSecurityProperties properties;

    public EmailNotifier(
            JavaMailSender mailSender,
            @Qualifier("emailScheduler") Scheduler emailScheduler,
            MetricsService metricsService,
            GeoSecurityProperties properties
    ) {
        this.mailSender = mailSender;
        this.emailScheduler = emailScheduler;
        this.metricsService = metricsService;
        this.properties = properties;
    }

    @Override
    public Mono<NotificationOutcome> send(NotificationMessage message) {
        List<String> recipients = message.getRecipients();
        if (recipients == null || recipients.isEmpty()) {
            logger.warn("Notification '{}' has no recipients configured", message.getSubject());
            metricsService.incrementCounter("notifications", "outcome", "no_recipients");
            return Mono.just(NotificationOutcome.failed(0, "No recipients configured"));
        }

        String masked = recipients.stream().map(HelperUtils::maskEmail).collect(Collectors.joining(", "));

        return Mono.fromCallable(() -> {
                    SimpleMailMessage mail = new SimpleMailMessage();
                    mail.setFrom(properties.getNotifications().getFrom());
                    mail.setTo(recipients.toArray(new String[0]));
                    mail.setSubject(subjectFor(message));
                    mail.setText(message.getBody());
                    mailSender.send(mail);
                    return NotificationOutcome.delivered(recipients.size());
                })
                .subscribeOn(emailScheduler)
                .timeout(properties.getNotifications().getSendTimeout())
                .doOnSuccess(outcome -> {
                    logger.info("✅ Notification '{}' sent to {}", message.getSubject(), masked);
                    metricsService.incrementCounter("notifications", "outcome", "delivered");
                })
                .onErrorResume(e -> {
                    logger.warn("❌ Notification '{}' to {} failed: {}", message.getSubject(), masked, e.getMessage());
                    metricsService.incrementCounter("notifications", "outcome", "failed");
                    return Mono.just(NotificationOutcome.failed(recipients.size(), e.getMessage()));
                });
    }

    private String subjectFor(NotificationMessage message) {
        NotificationPriority priority = message.getPriority();
        if (priority == NotificationPriority.CRITICAL || priority == NotificationPriority.HIGH) {
            return "[" + priority.name() + "] " + message.getSubject();
        }
        return message.getSubject();
    }
}
