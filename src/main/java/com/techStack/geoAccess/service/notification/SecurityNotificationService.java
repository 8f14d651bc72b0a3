package com.techStack.geoAccess.service.notification;

import com.techStack.geoAccess.dto.internal.EscalationReason;
import com.techStack.geoAccess.dto.internal.NotificationMessage;
import com.techStack.geoAccess.dto.internal.NotificationOutcome;
import com.techStack.geoAccess.dto.internal.NotificationPriority;
import com.techStack.geoAccess.event.ExceptionLifecycleEvent;
import com.techStack.geoAccess.models.access.AccessException;
import com.techStack.geoAccess.models.attempt.SuspiciousAccessAttempt;
import com.techStack.geoAccess.models.audit.AuditEntry;
import com.techStack.geoAccess.models.policy.SecurityPolicy;
import com.techStack.geoAccess.repository.notification.Notifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds security alerts and routes them to the audience configured on the policy.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SecurityNotificationService {

    private final Notifier notifier;

    /* ===== Policy changes → leadership ===== */

    public Mono<NotificationOutcome> notifyPolicyChange(SecurityPolicy policy, List<AuditEntry> entries) {
        StringBuilder body = new StringBuilder()
                .append("The geographic security policy")
                .append(departmentSuffix(policy))
                .append(" was changed and is effective immediately.\n\n");

        for (AuditEntry entry : entries) {
            body.append(String.format("- %s: %s -> %s%n",
                    entry.getChangeType(), display(entry.getOldValue()), display(entry.getNewValue())));
        }

        AuditEntry first = entries.get(0);
        body.append(String.format("%nChanged by: %s%nAt: %s%nFrom IP: %s%nJustification: %s%n",
                display(first.getActor()), first.getTimestamp(),
                display(first.getRequestIp()), display(first.getJustification())));
        body.append(String.format("Allowed countries now: %s%nEnforcement: %s%n",
                policy.getAllowedCountries(), policy.isEnforcementEnabled() ? "ENABLED" : "DISABLED"));

        return notifier.send(NotificationMessage.builder()
                .recipients(policy.getLeadershipRecipients())
                .subject("Security policy changed" + departmentSuffix(policy))
                .body(body.toString())
                .priority(NotificationPriority.HIGH)
                .build());
    }

    /* ===== Exception lifecycle → IT and requester ===== */

    public Mono<NotificationOutcome> notifyExceptionEvent(SecurityPolicy policy, ExceptionLifecycleEvent event) {
        AccessException exception = event.getException();
        Set<String> recipients = new LinkedHashSet<>(policy.getItRecipients());

        if (event.getAction() != ExceptionLifecycleEvent.Action.REQUESTED
                && StringUtils.isNotBlank(exception.getContactEmail())) {
            recipients.add(exception.getContactEmail().trim());
        }

        String subject = switch (event.getAction()) {
            case REQUESTED -> "International access exception requested";
            case APPROVED -> "International access exception approved";
            case DENIED -> "International access exception denied";
            case REVOKED -> "International access exception revoked";
        };

        String body = String.format(
                "Exception: %s%nUser: %s%nDestination: %s%nWindow: %s to %s%nStatus: %s%nReason: %s%n"
                        + "Reviewed by: %s%nNotes: %s%n",
                exception.getId(), exception.getUserId(), exception.getDestinationCountry(),
                exception.getStartsAt(), exception.getEndsAt(), exception.getStatus(),
                display(exception.getReason()),
                display(event.getAction() == ExceptionLifecycleEvent.Action.REVOKED
                        ? exception.getRevokedBy() : exception.getDecidedBy()),
                display(exception.getAdminNotes()));

        return notifier.send(NotificationMessage.builder()
                .recipients(List.copyOf(recipients))
                .subject(subject)
                .body(body)
                .priority(NotificationPriority.NORMAL)
                .build());
    }

    /* ===== Escalations → compliance / leadership ===== */

    public Mono<NotificationOutcome> notifyEscalation(SecurityPolicy policy,
                                                      SuspiciousAccessAttempt attempt,
                                                      Collection<EscalationReason> reasons,
                                                      int attemptCount,
                                                      Collection<String> recentCountries) {
        String body = String.format(
                "Suspicious access activity requires review.%n%n"
                        + "User: %s%nReasons: %s%nBlocked attempts in window: %d%nRecent countries: %s%n%n"
                        + "Latest attempt%n  IP: %s%n  Location: %s, %s%n  Type: %s%n  Threat level: %s%n"
                        + "  Path: %s%n  At: %s%n",
                attempt.getUserId(), reasons, attemptCount, recentCountries,
                attempt.getIpAddress(), display(attempt.getCity()), display(attempt.getCountryName()),
                attempt.getAttemptType(), attempt.getThreatLevel(),
                display(attempt.getRequestPath()), attempt.getTimestamp());

        return notifier.send(NotificationMessage.builder()
                .recipients(policy.getLeadershipRecipients())
                .subject("Suspicious access escalation for user " + attempt.getUserId())
                .body(body)
                .priority(reasons.contains(EscalationReason.ANONYMIZER_DETECTED)
                        ? NotificationPriority.CRITICAL : NotificationPriority.HIGH)
                .build());
    }

    /* ===== Integrity failures → IT and security ===== */

    public Mono<NotificationOutcome> notifyIntegrityFailure(SecurityPolicy policy,
                                                            List<String> entryIds,
                                                            Instant detectedAt) {
        String body = String.format(
                "Audit ledger verification FAILED at %s.%n%n"
                        + "%d entr%s no longer match their checksum and may have been altered:%n%s%n%n"
                        + "Treat the security policy history as compromised until investigated.",
                detectedAt, entryIds.size(), entryIds.size() == 1 ? "y" : "ies",
                String.join("\n", entryIds));

        return notifier.send(NotificationMessage.builder()
                .recipients(policy.getIntegrityRecipients())
                .subject("CRITICAL: audit ledger integrity failure")
                .body(body)
                .priority(NotificationPriority.CRITICAL)
                .build());
    }

    private static String departmentSuffix(SecurityPolicy policy) {
        String label = StringUtils.firstNonBlank(policy.getDepartmentAbbreviation(), policy.getDepartmentName());
        return label != null ? " (" + label + ")" : "";
    }

    private static String display(String value) {
        return StringUtils.defaultIfBlank(value, "-");
    }
}
