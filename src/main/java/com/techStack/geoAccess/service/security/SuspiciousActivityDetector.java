package com.techStack.geoAccess.service.security;

import com.techStack.geoAccess.config.GeoSecurityProperties;
import com.techStack.geoAccess.constants.GeoSecurityConstants;
import com.techStack.geoAccess.dto.internal.EscalationDecision;
import com.techStack.geoAccess.dto.internal.EscalationReason;
import com.techStack.geoAccess.dto.internal.NotificationOutcome;
import com.techStack.geoAccess.models.attempt.SuspiciousAccessAttempt;
import com.techStack.geoAccess.repository.SuspiciousAttemptRepository;
import com.techStack.geoAccess.repository.metrics.MetricsService;
import com.techStack.geoAccess.service.notification.SecurityNotificationService;
import com.techStack.geoAccess.service.policy.PolicyStore;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Suspicious Activity Detector
 *
 * Decides whether a blocked attempt warrants a leadership escalation:
 * - repeated blocked attempts by one user inside the rolling window
 * - any attempt from a proxy, VPN or Tor exit
 * - blocked attempts from several countries inside the hop window
 *
 * Attempts already covered by an earlier escalation do not count again, so a user who keeps
 * trying produces one notice per threshold crossing rather than one per attempt. Before notifying,
 * the attempts are claimed in a transaction and the triggers are re-checked against the claimed
 * set, so concurrent evaluations for one user cannot both escalate the same attempts. Attempts are
 * marked notified only after the notice was delivered; an undelivered notice releases its claim.
 */
@Slf4j
@Service
public class SuspiciousActivityDetector {

    private static final Logger securityLog = LoggerFactory.getLogger(GeoSecurityConstants.SECURITY_AUDIT_LOGGER);

    private final SuspiciousAttemptRepository attemptRepository;
    private final PolicyStore policyStore;
    private final SecurityNotificationService notificationService;
    private final MetricsService metricsService;
    private final GeoSecurityProperties properties;
    private final Scheduler securityEventScheduler;
    private final Clock clock;

    public SuspiciousActivityDetector(SuspiciousAttemptRepository attemptRepository,
                                      PolicyStore policyStore,
                                      SecurityNotificationService notificationService,
                                      MetricsService metricsService,
                                      GeoSecurityProperties properties,
                                      @Qualifier("securityEventScheduler") Scheduler securityEventScheduler,
                                      Clock clock) {
        this.attemptRepository = attemptRepository;
        this.policyStore = policyStore;
        this.notificationService = notificationService;
        this.metricsService = metricsService;
        this.properties = properties;
        this.securityEventScheduler = securityEventScheduler;
        this.clock = clock;
    }

    /**
     * Fire-and-forget evaluation on the security event scheduler.
     */
    public void evaluateAsync(SuspiciousAccessAttempt attempt) {
        evaluate(attempt)
                .subscribeOn(securityEventScheduler)
                .subscribe(
                        decision -> {
                            if (decision.isEscalated()) {
                                log.info("Escalation for attempt {} finished: reasons={}, delivered={}",
                                        attempt.getId(), decision.getReasons(), decision.isNotificationDelivered());
                            }
                        },
                        error -> log.error("❌ Escalation evaluation failed for attempt {}: {}",
                                attempt.getId(), error.getMessage(), error));
    }

    public Mono<EscalationDecision> evaluate(SuspiciousAccessAttempt attempt) {
        GeoSecurityProperties.Escalation config = properties.getEscalation();
        Instant reference = attempt.getTimestamp() != null ? attempt.getTimestamp() : clock.instant();
        Instant windowStart = reference.minus(config.getWindow());
        Instant hopStart = reference.minus(config.getCountryHopWindow());
        Instant since = windowStart.isBefore(hopStart) ? windowStart : hopStart;

        Flux<SuspiciousAccessAttempt> history = attempt.getUserId() == null
                ? Flux.empty()
                : attemptRepository.findByUserSince(attempt.getUserId(), since);

        return history.collectList()
                .map(found -> withCurrent(found, attempt))
                .flatMap(attempts -> {
                    List<SuspiciousAccessAttempt> inWindow = blockedSince(attempts, windowStart);
                    List<SuspiciousAccessAttempt> unnotified = inWindow.stream()
                            .filter(a -> !a.isItNotified())
                            .toList();
                    int attemptCount = inWindow.size();

                    List<SuspiciousAccessAttempt> hopping = blockedSince(attempts, hopStart).stream()
                            .filter(a -> !a.isItNotified())
                            .toList();

                    Set<EscalationReason> reasons = reasonsFor(attempt, unnotified, hopping, null);
                    if (reasons.isEmpty()) {
                        log.debug("Attempt {} below escalation thresholds ({} blocked in window)",
                                attempt.getId(), attemptCount);
                        return Mono.just(EscalationDecision.none(attemptCount));
                    }

                    List<String> recentCountries = inWindow.stream()
                            .map(SuspiciousAccessAttempt::getCountryCode)
                            .filter(Objects::nonNull)
                            .distinct()
                            .toList();

                    Set<String> candidates = new LinkedHashSet<>();
                    unnotified.forEach(a -> candidates.add(a.getId()));
                    hopping.forEach(a -> candidates.add(a.getId()));
                    candidates.add(attempt.getId());

                    Instant claimedAt = clock.instant();
                    return attemptRepository.claimForEscalation(candidates, claimedAt,
                                    claimedAt.minus(config.getClaimTimeout()))
                            .flatMap(claimed -> {
                                // another evaluation may have taken part of the history first
                                Set<EscalationReason> confirmed = reasonsFor(attempt, unnotified, hopping, claimed);
                                Set<String> used = attemptsFor(confirmed, attempt, claimed);
                                Set<String> unused = new LinkedHashSet<>(claimed);
                                unused.removeAll(used);

                                Mono<Void> releaseUnused = unused.isEmpty()
                                        ? Mono.empty()
                                        : attemptRepository.releaseClaim(unused);
                                if (confirmed.isEmpty()) {
                                    log.info("Attempt {} is already covered by a concurrent escalation", attempt.getId());
                                    return releaseUnused.thenReturn(EscalationDecision.none(attemptCount));
                                }
                                return releaseUnused.then(Mono.defer(() ->
                                        escalate(attempt, confirmed, attemptCount, recentCountries, used)));
                            });
                });
    }

    /**
     * Triggers met by the given attempts. With {@code claimed} set, only attempts held by this
     * evaluation count.
     */
    private Set<EscalationReason> reasonsFor(SuspiciousAccessAttempt attempt,
                                             List<SuspiciousAccessAttempt> unnotified,
                                             List<SuspiciousAccessAttempt> hopping,
                                             Set<String> claimed) {
        GeoSecurityProperties.Escalation config = properties.getEscalation();
        Set<EscalationReason> reasons = new LinkedHashSet<>();

        long repeated = unnotified.stream().filter(a -> claimed == null || claimed.contains(a.getId())).count();
        if (repeated >= config.getThreshold()) {
            reasons.add(EscalationReason.REPEATED_ATTEMPTS);
        }
        if (attempt.isAnonymized() && (claimed == null || claimed.contains(attempt.getId()))) {
            reasons.add(EscalationReason.ANONYMIZER_DETECTED);
        }
        long hopCountries = hopping.stream()
                .filter(a -> claimed == null || claimed.contains(a.getId()))
                .map(SuspiciousAccessAttempt::getCountryCode)
                .filter(Objects::nonNull)
                .distinct()
                .count();
        if (hopCountries >= config.getCountryHopThreshold()) {
            reasons.add(EscalationReason.RAPID_COUNTRY_CHANGE);
        }
        return reasons;
    }

    private static Set<String> attemptsFor(Set<EscalationReason> reasons,
                                           SuspiciousAccessAttempt attempt,
                                           Set<String> claimed) {
        if (reasons.contains(EscalationReason.REPEATED_ATTEMPTS)
                || reasons.contains(EscalationReason.RAPID_COUNTRY_CHANGE)) {
            return new LinkedHashSet<>(claimed);
        }
        if (reasons.contains(EscalationReason.ANONYMIZER_DETECTED)) {
            return new LinkedHashSet<>(Set.of(attempt.getId()));
        }
        return new LinkedHashSet<>();
    }

    private Mono<EscalationDecision> escalate(SuspiciousAccessAttempt attempt,
                                              Set<EscalationReason> reasons,
                                              int attemptCount,
                                              List<String> recentCountries,
                                              Set<String> toMark) {
        reasons.forEach(reason -> metricsService.incrementCounter("geo.escalations", "reason", reason.name()));
        securityLog.warn("Escalating attempt {} for user {}: reasons={}, blocked in window={}, countries={}",
                attempt.getId(), attempt.getUserId(), reasons, attemptCount, recentCountries);

        EscalationDecision.EscalationDecisionBuilder decision = EscalationDecision.builder()
                .escalated(true)
                .reasons(reasons)
                .attemptCount(attemptCount);

        return policyStore.get()
                .flatMap(policy -> notificationService.notifyEscalation(
                        policy, attempt, reasons, attemptCount, recentCountries))
                .onErrorResume(e -> Mono.just(NotificationOutcome.failed(0, e.getMessage())))
                .flatMap(outcome -> {
                    if (!outcome.isDelivered()) {
                        log.warn("⚠️ Escalation notice for attempt {} not delivered: {}",
                                attempt.getId(), outcome.getError());
                        return attemptRepository.releaseClaim(toMark)
                                .thenReturn(decision.notificationDelivered(false).build());
                    }
                    List<String> reasonNames = reasons.stream().map(Enum::name).toList();
                    Instant notifiedAt = clock.instant();
                    return attemptRepository.markNotified(toMark, notifiedAt, reasonNames)
                            .then(Mono.fromSupplier(() -> decision
                                    .notificationDelivered(true)
                                    .markedAttemptIds(toMark)
                                    .build()));
                });
    }

    private static List<SuspiciousAccessAttempt> withCurrent(List<SuspiciousAccessAttempt> found,
                                                             SuspiciousAccessAttempt current) {
        boolean present = found.stream().anyMatch(a -> Objects.equals(a.getId(), current.getId()));
        if (present) {
            return found;
        }
        List<SuspiciousAccessAttempt> all = new ArrayList<>(found);
        all.add(current);
        return all;
    }

    private static List<SuspiciousAccessAttempt> blockedSince(List<SuspiciousAccessAttempt> attempts, Instant since) {
        return attempts.stream()
                .filter(SuspiciousAccessAttempt::isWasBlocked)
                .filter(a -> a.getTimestamp() == null || !a.getTimestamp().isBefore(since))
                .toList();
    }
}
